package com.largomodo.rawconvert.service;

import org.apache.commons.exec.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.Charset;

/**
 * Base class for external process execution with timeout and exit code enforcement.
 * <p>
 * Provides watchdog-based timeout protection (prevents a hung decoder from stalling a
 * worker slot for the rest of the batch) and automatic non-zero exit code detection
 * (fails fast on tool errors with stderr captured for diagnostics).
 * <p>
 * Standard output is captured in memory and returned to the caller: tools driven here
 * write their result image to stdout.
 * <p>
 * Subclasses: DcrawDecoder
 */
public abstract class ExternalProcessDriver {

    // 120-second timeout: full-size demosaic of a 45MP raw takes 10-20s on a busy pool
    protected static final long DEFAULT_TIMEOUT_MS = 120_000;

    /**
     * Execute external command with timeout and exit code validation.
     *
     * @param cmdArray  Command and arguments (cmdArray[0] = binary path)
     * @param timeoutMs Watchdog timeout in milliseconds
     * @return Everything the process wrote to standard output
     * @throws ProcessTimeoutException if watchdog kills process
     * @throws ProcessFailureException if exit code != 0 or execution fails
     */
    protected byte[] executeCommand(String[] cmdArray, long timeoutMs) throws IOException {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("Timeout must be positive, got: " + timeoutMs + "ms");
        }
        if (cmdArray == null || cmdArray.length == 0) {
            throw new IllegalArgumentException("Command must not be empty");
        }

        // Build CommandLine from array; handleQuoting=false keeps paths with spaces as one argument
        CommandLine cmdLine = new CommandLine(cmdArray[0]);
        for (int i = 1; i < cmdArray.length; i++) {
            cmdLine.addArgument(cmdArray[i], false);
        }

        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();

        DefaultExecutor executor = new DefaultExecutor();
        executor.setStreamHandler(new PumpStreamHandler(stdout, stderr));

        ExecuteWatchdog watchdog = new ExecuteWatchdog(timeoutMs);
        executor.setWatchdog(watchdog);

        try {
            int exitCode = executor.execute(cmdLine);

            if (exitCode != 0) {
                throw new ProcessFailureException(
                        "Process exited with code " + exitCode + ": " + text(stderr)
                );
            }

            return stdout.toByteArray();

        } catch (ExecuteException e) {
            // Check watchdog FIRST: if process was killed, that's the root cause
            // ExecuteException alone is ambiguous (could be exit code or timeout)
            if (watchdog.killedProcess()) {
                throw new ProcessTimeoutException(
                        "Process exceeded timeout of " + timeoutMs + "ms"
                );
            }
            throw new ProcessFailureException(
                    "Process failed: " + e.getMessage() + "\nStderr: " + text(stderr)
            );
        }
    }

    private static String text(ByteArrayOutputStream stream) {
        return stream.toString(Charset.defaultCharset()).trim();
    }

    public static class ProcessTimeoutException extends IOException {
        public ProcessTimeoutException(String message) {
            super(message);
        }
    }

    public static class ProcessFailureException extends IOException {
        public ProcessFailureException(String message) {
            super(message);
        }
    }
}
