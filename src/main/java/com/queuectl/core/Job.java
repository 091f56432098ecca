package com.queuectl.core;

import org.json.JSONObject;

import java.time.Instant;

/**
 * A persisted job record as stored in the {@code jobs} table.
 *
 * <p>Instances are plain data holders filled in by the repository; every change to a
 * job goes through the store, never through these setters on a shared instance.</p>
 */
public class Job {
    private String id;
    private String command;
    private JobState state;
    private int attempts;
    private int maxRetries;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant nextRetryAt;
    private String workerId;
    private String output;
    private String error;

    public Job() {
    }

    public Job(String id, String command, int maxRetries) {
        this.id = id;
        this.command = command;
        this.state = JobState.PENDING;
        this.attempts = 0;
        this.maxRetries = maxRetries;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getCommand() { return command; }
    public void setCommand(String command) { this.command = command; }

    public JobState getState() { return state; }
    public void setState(JobState state) { this.state = state; }

    public int getAttempts() { return attempts; }
    public void setAttempts(int attempts) { this.attempts = attempts; }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public Instant getNextRetryAt() { return nextRetryAt; }
    public void setNextRetryAt(Instant nextRetryAt) { this.nextRetryAt = nextRetryAt; }

    public String getWorkerId() { return workerId; }
    public void setWorkerId(String workerId) { this.workerId = workerId; }

    public String getOutput() { return output; }
    public void setOutput(String output) { this.output = output; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    /**
     * Render the record with the persisted field names, nulls included.
     *
     * @return JSON object suitable for printing on the command line
     */
    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("id", id);
        json.put("command", command);
        json.put("state", state != null ? state.wireName() : JSONObject.NULL);
        json.put("attempts", attempts);
        json.put("max_retries", maxRetries);
        json.put("created_at", orNull(createdAt));
        json.put("updated_at", orNull(updatedAt));
        json.put("next_retry_at", orNull(nextRetryAt));
        json.put("worker_id", workerId != null ? workerId : JSONObject.NULL);
        json.put("output", output != null ? output : JSONObject.NULL);
        json.put("error", error != null ? error : JSONObject.NULL);
        return json;
    }

    private static Object orNull(Instant instant) {
        return instant != null ? instant.toString() : JSONObject.NULL;
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', state=" + state + ", attempts=" + attempts
                + "/" + maxRetries + ", workerId=" + workerId + "}";
    }
}
