package com.queuectl.app;

import com.queuectl.config.QueueConfig;
import com.queuectl.db.Database;
import com.queuectl.db.JobRepository;
import com.queuectl.engine.JobQueue;
import com.queuectl.engine.ShellCommandExecutor;
import com.queuectl.engine.Worker;

import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of one worker JVM, launched by {@code queuectl worker start}.
 *
 * <p>Usage: {@code WorkerProcess <workerId>}. The worker loop runs on the main thread.
 * SIGTERM (or Ctrl+C) triggers the shutdown hook, which asks the worker to drain and
 * waits up to 30 seconds for the in-flight job to be reported before the JVM exits.</p>
 */
public class WorkerProcess {
    private static final Logger logger = Logger.getLogger(WorkerProcess.class.getName());

    static final Duration DRAIN_DEADLINE = Duration.ofSeconds(30);

    public static void main(String[] args) {
        LoggingSetup.install();

        if (args.length != 1 || args[0].isBlank()) {
            System.err.println("Usage: WorkerProcess <workerId>");
            System.exit(2);
        }
        String workerId = args[0];

        QueueConfig config = QueueConfig.load();
        Database database = new Database(config.getDatabaseUrl());
        try {
            database.initialize();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Worker " + workerId + " could not open database " + database.getUrl(), e);
            System.exit(1);
        }

        JobQueue queue = new JobQueue(new JobRepository(database), config);
        ShellCommandExecutor executor = new ShellCommandExecutor(config.getJobTimeoutMs());
        Worker worker = new Worker(workerId, queue, executor, config.getPollIntervalMs());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("=== Shutdown signal received by " + workerId + " ===");
            worker.requestShutdown();
            try {
                if (!worker.awaitTermination(DRAIN_DEADLINE)) {
                    logger.warning("Worker " + workerId + " did not drain within "
                            + DRAIN_DEADLINE.getSeconds() + "s, exiting with job "
                            + worker.getCurrentJobId() + " still processing");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warning("Shutdown hook interrupted while draining " + workerId);
            } finally {
                database.close();
            }
        }, workerId + "-shutdown"));

        worker.run();
    }
}
