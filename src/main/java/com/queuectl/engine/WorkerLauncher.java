package com.queuectl.engine;

import java.io.IOException;

/**
 * Starts one worker as a separate OS process.
 */
public interface WorkerLauncher {

    /**
     * Launch a worker process.
     *
     * @param workerId the id the worker will use when acquiring jobs
     * @return the running process
     * @throws IOException if the process cannot be started
     */
    Process launch(String workerId) throws IOException;
}
