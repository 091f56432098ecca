package com.queuectl.core;

/**
 * Exception thrown when a job is enqueued with an id that already exists.
 *
 * <p>Ids are chosen by the client, so a collision is a client error. The existing
 * record is left untouched.</p>
 */
public class DuplicateJobException extends RuntimeException {

    private final String jobId;

    public DuplicateJobException(String jobId) {
        super("Job with id " + jobId + " already exists");
        this.jobId = jobId;
    }

    public DuplicateJobException(String jobId, Throwable cause) {
        super("Job with id " + jobId + " already exists", cause);
        this.jobId = jobId;
    }

    /**
     * Get the id that collided.
     *
     * @return the duplicate job id
     */
    public String getJobId() {
        return jobId;
    }
}
