package org.jenkinsci.test_partitioner;

/**
 * Signals invalid input from the pipeline, such as a malformed descriptor. The run is aborted with the message.
 */
public class ConfigurationException extends Exception {
    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
