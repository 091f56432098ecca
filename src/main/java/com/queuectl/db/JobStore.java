package com.queuectl.db;

import com.queuectl.core.Job;
import com.queuectl.core.JobState;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persistence contract the queue engine is built on.
 *
 * <p>Worker processes share nothing but the store, so every method that changes a job
 * must be a single atomic statement on the store side. In particular
 * {@link #acquireNext(String, Instant)} is the only thing that keeps two workers from
 * picking up the same job: it must select and transition the row in one indivisible
 * operation, never as a read followed by a separate write.</p>
 *
 * <p>All methods report store failures as {@link SQLException}; callers decide whether
 * that is fatal (command line) or transient (worker loop).</p>
 */
public interface JobStore extends AutoCloseable {

    /**
     * Insert a new job.
     *
     * @param job the job to create; {@code createdAt}/{@code updatedAt} are assigned by the store
     * @return the persisted record
     * @throws com.queuectl.core.DuplicateJobException if a job with the same id exists
     * @throws SQLException if the store fails
     */
    Job create(Job job) throws SQLException;

    /**
     * Point lookup by id.
     *
     * @param id the job id
     * @return the job, or null if there is none
     * @throws SQLException if the store fails
     */
    Job findById(String id) throws SQLException;

    /**
     * Atomically claim the oldest job that is pending, or failed with its retry time
     * reached at {@code now}, for the given worker.
     *
     * @param workerId the worker taking ownership
     * @param now the instant retry eligibility is evaluated against
     * @return the job after the transition to processing, or null if nothing is eligible
     * @throws SQLException if the store fails
     */
    Job acquireNext(String workerId, Instant now) throws SQLException;

    /**
     * Apply a partial update to one job, honouring the update's guards.
     *
     * @param id the job id
     * @param update the columns to set and the optional expected state/attempts
     * @return the job after the update, or null if no row matched the id and guards
     * @throws SQLException if the store fails
     */
    Job update(String id, JobUpdate update) throws SQLException;

    /**
     * Count jobs per state. States with no jobs may be absent from the map.
     *
     * @return counts keyed by state
     * @throws SQLException if the store fails
     */
    Map<JobState, Long> countByState() throws SQLException;

    /**
     * List jobs, newest first.
     *
     * @param state only return jobs in this state, or null for all jobs
     * @return the matching jobs
     * @throws SQLException if the store fails
     */
    List<Job> list(JobState state) throws SQLException;

    /**
     * List dead jobs, most recently dead-lettered first.
     *
     * @return the dead letter queue
     * @throws SQLException if the store fails
     */
    List<Job> listDead() throws SQLException;

    @Override
    void close();
}
