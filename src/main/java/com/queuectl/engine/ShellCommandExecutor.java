package com.queuectl.engine;

import com.queuectl.core.ExecutionResult;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs commands through the platform shell ({@code sh -c} or {@code cmd /c}).
 *
 * <p>stdout and stderr are drained on separate threads so a chatty command cannot block
 * on a full pipe. Exit codes follow shell conventions for the cases the command itself
 * never reports: 127 when the shell cannot be started, 124 on timeout.</p>
 */
public class ShellCommandExecutor implements CommandExecutor {
    private static final Logger logger = Logger.getLogger(ShellCommandExecutor.class.getName());

    static final int EXIT_SPAWN_FAILED = 127;
    static final int EXIT_TIMED_OUT = 124;

    // Time allowed for the stream readers to finish once the process is gone
    private static final long STREAM_DRAIN_MS = 2_000L;

    private final long timeoutMs;

    public ShellCommandExecutor(long timeoutMs) {
        if (timeoutMs < 1) {
            throw new IllegalArgumentException("Timeout must be positive, got " + timeoutMs);
        }
        this.timeoutMs = timeoutMs;
    }

    @Override
    public ExecutionResult execute(String command) {
        long startTime = System.currentTimeMillis();
        Process process;

        try {
            process = new ProcessBuilder(shellCommand(command)).start();
        } catch (IOException e) {
            long duration = System.currentTimeMillis() - startTime;
            logger.log(Level.WARNING, "Failed to start command: " + command, e);
            return ExecutionResult.failure(EXIT_SPAWN_FAILED, "", e.getMessage(), duration,
                    "Failed to start command: " + e.getMessage());
        }

        closeStdin(process);

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));

        try {
            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                process.waitFor(STREAM_DRAIN_MS, TimeUnit.MILLISECONDS);
                long duration = System.currentTimeMillis() - startTime;
                String message = "Command timed out after " + timeoutMs + "ms";
                logger.warning(message + ": " + command);
                return ExecutionResult.failure(EXIT_TIMED_OUT, collect(stdout), collect(stderr), duration, message);
            }

            int exitCode = process.exitValue();
            long duration = System.currentTimeMillis() - startTime;
            String out = collect(stdout);
            String err = collect(stderr);

            if (exitCode == 0) {
                return ExecutionResult.success(out, err, duration);
            }
            return ExecutionResult.failure(exitCode, out, err, duration,
                    "Command failed with exit code " + exitCode);

        } catch (InterruptedException e) {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            long duration = System.currentTimeMillis() - startTime;
            return ExecutionResult.failure(EXIT_TIMED_OUT, collect(stdout), collect(stderr), duration,
                    "Command interrupted");
        }
    }

    static List<String> shellCommand(String command) {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            return List.of("cmd.exe", "/c", command);
        }
        return List.of("sh", "-c", command);
    }

    // Jobs get no stdin; close it so commands reading input see EOF instead of hanging
    private static void closeStdin(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            logger.log(Level.FINE, "Could not close command stdin", e);
        }
    }

    private static String readFully(InputStream in) {
        try (InputStream stream = in) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            stream.transferTo(buffer);
            return buffer.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            // The stream closes underneath us when a timed-out process is destroyed
            logger.log(Level.FINE, "Command stream closed early", e);
            return "";
        }
    }

    private static String collect(CompletableFuture<String> stream) {
        try {
            return stream.get(STREAM_DRAIN_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (ExecutionException | TimeoutException e) {
            logger.log(Level.FINE, "Command output not fully collected", e);
            return "";
        }
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
