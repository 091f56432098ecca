package com.queuectl.core;

/**
 * Outcome of running one job command.
 *
 * <p>Every way a command can end (zero exit, non-zero exit, spawn failure, timeout)
 * is normalised into this structure, so the worker never has to catch command
 * failures as exceptions. {@code message} is only set when there is something to say
 * beyond the streams, typically on failure.</p>
 */
public final class ExecutionResult {
    private final boolean succeeded;
    private final int exitCode;
    private final String stdout;
    private final String stderr;
    private final long durationMs;
    private final String message;

    public ExecutionResult(boolean succeeded, int exitCode, String stdout, String stderr,
                           long durationMs, String message) {
        this.succeeded = succeeded;
        this.exitCode = exitCode;
        this.stdout = stdout != null ? stdout : "";
        this.stderr = stderr != null ? stderr : "";
        this.durationMs = durationMs;
        this.message = message;
    }

    public static ExecutionResult success(String stdout, String stderr, long durationMs) {
        return new ExecutionResult(true, 0, stdout, stderr, durationMs, null);
    }

    public static ExecutionResult failure(int exitCode, String stdout, String stderr,
                                          long durationMs, String message) {
        return new ExecutionResult(false, exitCode, stdout, stderr, durationMs, message);
    }

    /**
     * Build a failure result for an exception raised while trying to run a command.
     *
     * @param e the exception
     * @return a failed result with exit code 1 and the exception message on stderr
     */
    public static ExecutionResult fromException(Exception e) {
        String text = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new ExecutionResult(false, 1, "", text, 0, text);
    }

    public boolean isSucceeded() { return succeeded; }
    public int getExitCode() { return exitCode; }
    public String getStdout() { return stdout; }
    public String getStderr() { return stderr; }
    public long getDurationMs() { return durationMs; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return "ExecutionResult{succeeded=" + succeeded + ", exitCode=" + exitCode
                + ", durationMs=" + durationMs + (message != null ? ", message='" + message + "'" : "") + "}";
    }
}
