package com.queuectl.core;

/**
 * Exception thrown when a dead letter queue retry targets a job that is not dead
 * (or does not exist at all).
 */
public class NotInDLQException extends RuntimeException {

    private final String jobId;

    public NotInDLQException(String jobId) {
        super("Job " + jobId + " not found in DLQ");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
