package org.jenkinsci.test_partitioner;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Locale;

/**
 * Human readable trace of one partitioning run. Every message is expected to reach its destination once
 * {@link #flush()} returns, so that an aborted run still leaves a readable trace behind.
 */
public interface TraceLog {

    void append(@NonNull String message);

    void flush();

    default void println(@NonNull String message) {
        append(message + "\n");
        flush();
    }

    default void printf(@NonNull String format, Object... args) {
        append(String.format(Locale.ROOT, format, args));
        flush();
    }
}
