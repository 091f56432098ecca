package com.queuectl.engine;

import com.queuectl.config.QueueConfig;
import com.queuectl.core.DuplicateJobException;
import com.queuectl.core.ExecutionResult;
import com.queuectl.core.InvalidJobException;
import com.queuectl.core.Job;
import com.queuectl.core.JobSpec;
import com.queuectl.core.JobState;
import com.queuectl.core.JobStats;
import com.queuectl.core.NotInDLQException;
import com.queuectl.db.JobStore;
import com.queuectl.db.JobUpdate;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * The queue engine: every job state change goes through this class.
 *
 * <p><b>Key Responsibilities:</b></p>
 * <ul>
 *   <li>Validate and enqueue new jobs as PENDING</li>
 *   <li>Hand out jobs to workers through the store's atomic acquire</li>
 *   <li>Record success (COMPLETED) and failure (FAILED with backoff, or DEAD)</li>
 *   <li>Release jobs abandoned by dead workers back to PENDING</li>
 *   <li>Resurrect dead-lettered jobs on request</li>
 * </ul>
 *
 * <p><b>Concurrency:</b> instances hold no mutable state. Workers in other processes
 * use their own {@code JobQueue} over the same database, so every transition is a single
 * conditional update in the store; nothing here relies on a Java lock.</p>
 *
 * <p><b>Ownership:</b> {@link #completeJob} and {@link #failJob} do not check that the
 * reporting worker still owns the job. A job released and re-acquired by another worker
 * can be overwritten by a late report from the first one.</p>
 *
 * @see JobStore#acquireNext(String, Instant)
 * @see BackoffPolicy
 */
public class JobQueue implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(JobQueue.class.getName());

    static final String MAX_RETRIES_EXCEEDED = "Max retries exceeded";
    static final String EXECUTION_FAILED = "Job execution failed";

    // Upper bound on re-reads when another writer changes attempts under us
    private static final int MAX_FAIL_ATTEMPTS = 5;

    private final JobStore store;
    private final QueueConfig config;
    private final Clock clock;

    public JobQueue(JobStore store, QueueConfig config) {
        this(store, config, Clock.systemUTC());
    }

    public JobQueue(JobStore store, QueueConfig config, Clock clock) {
        this.store = store;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Add a new job to the queue.
     *
     * @param spec id, command and optional max_retries
     * @return the persisted job: PENDING, zero attempts
     * @throws InvalidJobException if id or command is missing, or max_retries is not positive
     * @throws DuplicateJobException if a job with this id already exists
     * @throws SQLException if the store fails
     */
    public Job enqueue(JobSpec spec) throws SQLException {
        if (spec == null || isBlank(spec.getId()) || isBlank(spec.getCommand())) {
            throw new InvalidJobException("Job must have id and command fields");
        }
        if (spec.getMaxRetries() != null && spec.getMaxRetries() < 1) {
            throw new InvalidJobException("max_retries must be a positive number, got " + spec.getMaxRetries());
        }

        // Ids are chosen by clients, so a collision here is their error; the store's
        // unique key catches the rare case where two clients race on the same id
        if (store.findById(spec.getId()) != null) {
            throw new DuplicateJobException(spec.getId());
        }

        int maxRetries = spec.getMaxRetries() != null ? spec.getMaxRetries() : config.getMaxRetries();
        Job created = store.create(new Job(spec.getId(), spec.getCommand(), maxRetries));

        logger.info("Job enqueued: " + created.getId() + " (max retries " + maxRetries + ")");
        return created;
    }

    /**
     * @return the job, or null if there is no job with this id
     */
    public Job getJob(String jobId) throws SQLException {
        return store.findById(jobId);
    }

    /**
     * Claim the oldest eligible job for a worker.
     *
     * <p>Eligible means PENDING, or FAILED with its retry time reached. The transition to
     * PROCESSING happens in one atomic store operation, so concurrent callers, in this
     * process or any other, never receive the same job.</p>
     *
     * @param workerId the claiming worker
     * @return the job now owned by {@code workerId}, or null if none is eligible
     * @throws SQLException if the store fails
     */
    public Job acquireJob(String workerId) throws SQLException {
        return store.acquireNext(workerId, clock.instant());
    }

    /**
     * Mark a job COMPLETED with the command's output.
     *
     * <p>Only a PROCESSING job can complete. For any other state the job is left as it is
     * and returned unchanged.</p>
     *
     * @param jobId the job
     * @param result the successful execution result
     * @return the updated job; the unchanged job if it was not PROCESSING; null if absent
     * @throws SQLException if the store fails
     */
    public Job completeJob(String jobId, ExecutionResult result) throws SQLException {
        JobUpdate update = JobUpdate.set()
                .state(JobState.COMPLETED)
                .output(result.getStdout())
                .workerId(null)
                .whereState(JobState.PROCESSING);
        if (!result.getStderr().isEmpty()) {
            update.error(result.getStderr());
        }

        Job job = store.update(jobId, update);
        if (job != null) {
            logger.info("Job " + jobId + " completed in " + result.getDurationMs() + "ms");
            return job;
        }

        Job current = store.findById(jobId);
        if (current == null) {
            logger.warning("Cannot complete job " + jobId + ": not found");
        } else {
            logger.warning("Refusing to complete job " + jobId + ": it is " + current.getState()
                    + ", not " + JobState.PROCESSING);
        }
        return current;
    }

    /**
     * Record a failed attempt.
     *
     * <p>The attempt count goes up by one. If it reaches {@code max_retries} the job is
     * dead-lettered (DEAD, no retry time). Otherwise it becomes FAILED with
     * {@code next_retry_at = now + backoff(attempts)}. The error recorded is the
     * command's stderr, else the result message, else a generic text.</p>
     *
     * <p>The write is guarded by the state and attempt count the decision was based on; if
     * another writer changed them in between, the job is read again and the decision
     * recomputed. A job that is no longer PROCESSING (released, or already reported) is
     * returned unchanged.</p>
     *
     * @param jobId the job
     * @param result the failed execution result
     * @param workerId the reporting worker, used for logging only
     * @return the updated job; the unchanged job if it was not PROCESSING; null if absent
     * @throws SQLException if the store fails
     */
    public Job failJob(String jobId, ExecutionResult result, String workerId) throws SQLException {
        for (int round = 0; round < MAX_FAIL_ATTEMPTS; round++) {
            Job job = store.findById(jobId);
            if (job == null) {
                logger.warning("Cannot fail job " + jobId + ": not found");
                return null;
            }

            int attempts = job.getAttempts() + 1;
            JobState target = attempts >= job.getMaxRetries() ? JobState.DEAD : JobState.FAILED;
            if (!job.getState().canTransitionTo(target)) {
                logger.warning("Refusing to fail job " + jobId + " reported by worker " + workerId
                        + ": it is " + job.getState() + ", cannot move to " + target);
                return job;
            }

            JobUpdate update = JobUpdate.set()
                    .attempts(attempts)
                    .output(result.getStdout())
                    .workerId(null)
                    .whereState(job.getState())
                    .whereAttempts(job.getAttempts());

            if (target == JobState.DEAD) {
                update.state(JobState.DEAD)
                        .nextRetryAt(null)
                        .error(errorText(result, MAX_RETRIES_EXCEEDED));
            } else {
                BackoffPolicy backoff = new BackoffPolicy(config.getBackoffBase());
                update.state(JobState.FAILED)
                        .nextRetryAt(backoff.nextRetryAt(clock.instant(), attempts))
                        .error(errorText(result, EXECUTION_FAILED));
            }

            Job updated = store.update(jobId, update);
            if (updated != null) {
                if (updated.getState() == JobState.DEAD) {
                    logger.warning("Job " + jobId + " exhausted retries after " + attempts
                            + " attempt(s) on worker " + workerId + ", moved to DLQ");
                } else {
                    logger.info("Job " + jobId + " failed on worker " + workerId + " (attempt " + attempts
                            + "/" + updated.getMaxRetries() + "), retry at " + updated.getNextRetryAt());
                }
                return updated;
            }
            logger.fine("Job " + jobId + " changed concurrently, re-reading");
        }
        throw new SQLException("Could not record failure of job " + jobId
                + ": it kept changing concurrently");
    }

    /**
     * Return a job abandoned by a dead worker to PENDING without counting an attempt.
     *
     * @param jobId the job
     * @return the released job; the unchanged job if it was not PROCESSING; null if absent
     * @throws SQLException if the store fails
     */
    public Job releaseJob(String jobId) throws SQLException {
        Job released = store.update(jobId, JobUpdate.set()
                .state(JobState.PENDING)
                .workerId(null)
                .whereState(JobState.PROCESSING));
        if (released != null) {
            logger.info("Released job " + jobId + " back to pending");
            return released;
        }
        return store.findById(jobId);
    }

    /**
     * Release every PROCESSING job owned by one of the given workers, typically workers
     * that were force-killed and will never report.
     *
     * @param workerIds ids of workers known to be gone
     * @return how many jobs were released
     * @throws SQLException if the store fails
     */
    public int releaseJobsOwnedBy(Collection<String> workerIds) throws SQLException {
        if (workerIds == null || workerIds.isEmpty()) {
            return 0;
        }
        Set<String> gone = new HashSet<>(workerIds);
        int released = 0;

        for (Job job : store.list(JobState.PROCESSING)) {
            if (gone.contains(job.getWorkerId())) {
                Job after = releaseJob(job.getId());
                if (after != null && after.getState() == JobState.PENDING) {
                    released++;
                }
            }
        }

        if (released > 0) {
            logger.info("Released " + released + " job(s) held by stopped workers");
        }
        return released;
    }

    /**
     * Move a dead job back to PENDING with a fresh retry budget.
     *
     * @param jobId the dead job
     * @return the job, now PENDING with zero attempts and the configured max_retries
     * @throws NotInDLQException if the job does not exist or is not DEAD
     * @throws SQLException if the store fails
     */
    public Job retryDLQJob(String jobId) throws SQLException {
        Job job = store.update(jobId, JobUpdate.set()
                .state(JobState.PENDING)
                .attempts(0)
                .maxRetries(config.getMaxRetries())
                .nextRetryAt(null)
                .workerId(null)
                .error(null)
                .whereState(JobState.DEAD));
        if (job == null) {
            throw new NotInDLQException(jobId);
        }
        logger.info("Job " + jobId + " moved from DLQ back to the queue");
        return job;
    }

    /**
     * @param state only jobs in this state, or null for all
     * @return jobs, newest first
     */
    public List<Job> listJobs(JobState state) throws SQLException {
        return store.list(state);
    }

    /**
     * @return dead jobs, most recently dead-lettered first
     */
    public List<Job> getDLQJobs() throws SQLException {
        return store.listDead();
    }

    /**
     * @return per-state counts with every state present and the total
     */
    public JobStats getStats() throws SQLException {
        return new JobStats(store.countByState());
    }

    @Override
    public void close() {
        store.close();
    }

    private static String errorText(ExecutionResult result, String fallback) {
        if (!result.getStderr().isEmpty()) {
            return result.getStderr();
        }
        if (!isBlank(result.getMessage())) {
            return result.getMessage();
        }
        return fallback;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
