package com.queuectl.engine;

import com.queuectl.core.ExecutionResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for running commands through the shell. Unix shells only.
 */
@DisabledOnOs(OS.WINDOWS)
public class ShellCommandExecutorTest {

    private final ShellCommandExecutor executor = new ShellCommandExecutor(10_000);

    @Test
    public void testSuccessCapturesStdout() {
        ExecutionResult result = executor.execute("echo hello");

        assertTrue(result.isSucceeded());
        assertEquals(0, result.getExitCode());
        assertEquals("hello\n", result.getStdout());
        assertEquals("", result.getStderr());
    }

    @Test
    public void testNonZeroExitIsFailure() {
        ExecutionResult result = executor.execute("echo oops >&2; exit 3");

        assertFalse(result.isSucceeded());
        assertEquals(3, result.getExitCode());
        assertEquals("oops\n", result.getStderr());
        assertEquals("Command failed with exit code 3", result.getMessage());
    }

    @Test
    public void testFalse() {
        assertFalse(executor.execute("false").isSucceeded());
    }

    @Test
    public void testUnknownCommandFailsWithoutThrowing() {
        ExecutionResult result = executor.execute("definitely-not-a-command-queuectl");

        assertFalse(result.isSucceeded());
        assertEquals(127, result.getExitCode(), "the shell reports command not found as 127");
    }

    @Test
    public void testTimeoutKillsCommand() {
        ShellCommandExecutor quick = new ShellCommandExecutor(300);
        long start = System.currentTimeMillis();

        ExecutionResult result = quick.execute("sleep 30");

        assertFalse(result.isSucceeded());
        assertEquals(ShellCommandExecutor.EXIT_TIMED_OUT, result.getExitCode());
        assertEquals("Command timed out after 300ms", result.getMessage());
        assertTrue(System.currentTimeMillis() - start < 10_000, "timed-out command must not run to completion");
    }

    @Test
    public void testStdinIsClosed() {
        ExecutionResult result = executor.execute("cat");
        assertTrue(result.isSucceeded(), "cat must see EOF rather than hang");
    }

    @Test
    public void testShellCommand() {
        assertEquals(List.of("sh", "-c", "echo hi"), ShellCommandExecutor.shellCommand("echo hi"));
    }

    @Test
    public void testInvalidTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new ShellCommandExecutor(0));
    }
}
