package com.queuectl.engine;

import com.queuectl.core.ExecutionResult;
import com.queuectl.core.Job;

import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One worker's poll / execute / report loop.
 *
 * <p>Each worker process runs exactly one of these. Work is strictly sequential: the
 * worker never holds more than one job, and it does not share memory with other workers.
 * Exclusion between workers comes entirely from {@link JobQueue#acquireJob(String)}.</p>
 *
 * <p><b>Main Loop:</b></p>
 * <ol>
 *   <li>Acquire the oldest eligible job</li>
 *   <li>If there is one: run its command, then complete or fail it</li>
 *   <li>If there is none: wait the poll interval (1 second by default)</li>
 * </ol>
 *
 * <p><b>Error Handling:</b></p>
 * <ul>
 *   <li>Command failures never escape the executor; they arrive as failed results</li>
 *   <li>Exceptions thrown by the executor anyway are turned into failed results</li>
 *   <li>SQLException: logged, 2-second back-off, loop continues</li>
 *   <li>Other exceptions: logged, 1-second pause, loop continues</li>
 * </ul>
 *
 * <p><b>Shutdown:</b> {@link #requestShutdown()} only sets a flag, checked between
 * cycles. A job that is executing is allowed to finish and be reported; nothing
 * interrupts it. The owner bounds the wait with {@link #awaitTermination(Duration)} and
 * terminates the process if the deadline passes. When the loop ends the worker closes
 * its queue and moves to {@link WorkerState#STOPPED}.</p>
 *
 * @see WorkerState
 * @see FleetSupervisor
 */
public class Worker implements Runnable {
    private static final Logger logger = Logger.getLogger(Worker.class.getName());

    static final long STORE_ERROR_BACKOFF_MS = 2_000L;
    static final long UNEXPECTED_ERROR_BACKOFF_MS = 1_000L;

    private final String workerId;
    private final JobQueue queue;
    private final CommandExecutor executor;
    private final long pollIntervalMs;

    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.POLLING);
    // Counted down on shutdown request so an idle wait ends immediately
    private final CountDownLatch shutdownSignal = new CountDownLatch(1);
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final AtomicLong processedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();
    private volatile String currentJobId;

    public Worker(String workerId, JobQueue queue, CommandExecutor executor, long pollIntervalMs) {
        this.workerId = workerId;
        this.queue = queue;
        this.executor = executor;
        this.pollIntervalMs = pollIntervalMs;
    }

    /**
     * Run the loop until shutdown is requested, then close the queue.
     *
     * <p><b>BLOCKING METHOD:</b> returns only after {@link #requestShutdown()}.</p>
     */
    @Override
    public void run() {
        logger.info("Worker " + workerId + " started");

        try {
            while (!shuttingDown.get()) {
                try {
                    boolean processed = processOne();

                    if (!processed && awaitShutdown(pollIntervalMs)) {
                        break;
                    }
                } catch (InterruptedException e) {
                    logger.info("Worker " + workerId + " interrupted, shutting down");
                    Thread.currentThread().interrupt();
                    break;
                } catch (SQLException e) {
                    // Store trouble is usually transient (server handover, lock timeout)
                    logger.log(Level.SEVERE, "Worker " + workerId + " store error", e);
                    if (pause(STORE_ERROR_BACKOFF_MS)) {
                        break;
                    }
                } catch (Exception e) {
                    logger.log(Level.SEVERE, "Worker " + workerId + " unexpected error", e);
                    if (pause(UNEXPECTED_ERROR_BACKOFF_MS)) {
                        break;
                    }
                }
            }
        } finally {
            state.set(WorkerState.DRAINING);
            try {
                queue.close();
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Worker " + workerId + " failed to close its queue", e);
            }
            state.set(WorkerState.STOPPED);
            stopped.countDown();
            logger.info("Worker " + workerId + " stopped (processed " + processedCount.get()
                    + ", failed " + failedCount.get() + ")");
        }
    }

    /**
     * Acquire, execute and report a single job.
     *
     * @return true if a job was processed, false if none was eligible
     * @throws SQLException if the store fails while acquiring or reporting
     */
    public boolean processOne() throws SQLException {
        Job job = queue.acquireJob(workerId);
        if (job == null) {
            return false;
        }

        currentJobId = job.getId();
        state.set(WorkerState.EXECUTING);
        try {
            logger.info("Worker " + workerId + " processing job " + job.getId() + ": " + job.getCommand());

            ExecutionResult result;
            try {
                result = executor.execute(job.getCommand());
            } catch (Exception e) {
                logger.log(Level.WARNING, "Executor threw for job " + job.getId(), e);
                result = ExecutionResult.fromException(e);
            }

            if (result.isSucceeded()) {
                queue.completeJob(job.getId(), result);
                processedCount.incrementAndGet();
            } else {
                queue.failJob(job.getId(), result, workerId);
                failedCount.incrementAndGet();
                logger.info("Worker " + workerId + " failed job " + job.getId() + " (attempt "
                        + (job.getAttempts() + 1) + "/" + job.getMaxRetries() + "): " + result);
            }
            return true;
        } finally {
            currentJobId = null;
            state.set(shuttingDown.get() ? WorkerState.DRAINING : WorkerState.POLLING);
        }
    }

    /**
     * Ask the loop to stop after the current cycle. Safe to call from any thread,
     * any number of times.
     */
    public void requestShutdown() {
        if (shuttingDown.compareAndSet(false, true)) {
            String inFlight = currentJobId;
            if (inFlight != null) {
                logger.info("Worker " + workerId + " shutting down, finishing job " + inFlight);
            } else {
                logger.info("Worker " + workerId + " shutting down");
            }
            state.compareAndSet(WorkerState.POLLING, WorkerState.DRAINING);
            shutdownSignal.countDown();
        }
    }

    /**
     * Wait for the loop to stop.
     *
     * @param timeout how long to wait
     * @return true if the worker stopped, false if the timeout elapsed first
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    // Returns true if shutdown was requested during the wait
    private boolean awaitShutdown(long millis) throws InterruptedException {
        return shutdownSignal.await(millis, TimeUnit.MILLISECONDS);
    }

    private boolean pause(long millis) {
        try {
            return awaitShutdown(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    public String getWorkerId() { return workerId; }
    public WorkerState getState() { return state.get(); }
    public boolean isShuttingDown() { return shuttingDown.get(); }
    public String getCurrentJobId() { return currentJobId; }
    public long getProcessedCount() { return processedCount.get(); }
    public long getFailedCount() { return failedCount.get(); }
}
