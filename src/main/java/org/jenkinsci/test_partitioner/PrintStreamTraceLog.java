package org.jenkinsci.test_partitioner;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link TraceLog} backed by a {@link PrintStream}, typically a log file created per run.
 */
public class PrintStreamTraceLog implements TraceLog, Closeable {

    private final PrintStream out;

    public PrintStreamTraceLog(@NonNull OutputStream out) {
        this.out = new PrintStream(out, true, StandardCharsets.UTF_8);
    }

    /**
     * Creates or truncates the given file.
     */
    public static PrintStreamTraceLog open(@NonNull Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return new PrintStreamTraceLog(Files.newOutputStream(file));
    }

    @Override
    public void append(@NonNull String message) {
        out.print(message);
    }

    @Override
    public void flush() {
        out.flush();
    }

    /**
     * @throws IOException if any message could not be written, since {@link PrintStream} only records such failures
     */
    @Override
    public void close() throws IOException {
        boolean failed = out.checkError();
        out.close();
        if (failed || out.checkError()) {
            throw new IOException("Failed to write the trace, it is incomplete");
        }
    }
}
