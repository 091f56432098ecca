package com.queuectl.engine;

import com.queuectl.core.ExecutionResult;

/**
 * Runs a job's command and reports how it went.
 *
 * <p>Implementations must not let command outcomes escape as exceptions: a non-zero
 * exit, a command that cannot be started and a timeout are all returned as a failed
 * {@link ExecutionResult}.</p>
 */
public interface CommandExecutor {

    /**
     * Run the command to completion or timeout.
     *
     * @param command the shell command line
     * @return the normalised outcome
     */
    ExecutionResult execute(String command);
}
