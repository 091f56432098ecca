package com.queuectl.db;

import com.queuectl.core.JobState;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A partial update of a job row, with optional guards on the row's current values.
 *
 * <p>Only the columns that were set are written; {@code updated_at} is always refreshed
 * by the store. Guards turn the update into a compare-and-set: the row is only touched
 * if its state (and/or attempt count) still matches what the caller based its decision on.</p>
 *
 * <pre>{@code
 * JobUpdate.set()
 *     .state(JobState.PENDING)
 *     .workerId(null)
 *     .whereState(JobState.PROCESSING);
 * }</pre>
 */
public final class JobUpdate {

    /** Columns a caller may change. Identity and creation time are immutable. */
    public enum Column {
        STATE("state"),
        ATTEMPTS("attempts"),
        MAX_RETRIES("max_retries"),
        NEXT_RETRY_AT("next_retry_at"),
        WORKER_ID("worker_id"),
        OUTPUT("output"),
        ERROR("error");

        private final String columnName;

        Column(String columnName) {
            this.columnName = columnName;
        }

        public String columnName() {
            return columnName;
        }
    }

    private final Map<Column, Object> values = new EnumMap<>(Column.class);
    private JobState expectedState;
    private Integer expectedAttempts;

    private JobUpdate() {
    }

    public static JobUpdate set() {
        return new JobUpdate();
    }

    public JobUpdate state(JobState state) {
        values.put(Column.STATE, state);
        return this;
    }

    public JobUpdate attempts(int attempts) {
        values.put(Column.ATTEMPTS, attempts);
        return this;
    }

    public JobUpdate maxRetries(int maxRetries) {
        values.put(Column.MAX_RETRIES, maxRetries);
        return this;
    }

    public JobUpdate nextRetryAt(Instant nextRetryAt) {
        values.put(Column.NEXT_RETRY_AT, nextRetryAt);
        return this;
    }

    public JobUpdate workerId(String workerId) {
        values.put(Column.WORKER_ID, workerId);
        return this;
    }

    public JobUpdate output(String output) {
        values.put(Column.OUTPUT, output);
        return this;
    }

    public JobUpdate error(String error) {
        values.put(Column.ERROR, error);
        return this;
    }

    /**
     * Only apply the update if the row is currently in the given state.
     */
    public JobUpdate whereState(JobState state) {
        this.expectedState = state;
        return this;
    }

    /**
     * Only apply the update if the row's attempt count is still the given value.
     */
    public JobUpdate whereAttempts(int attempts) {
        this.expectedAttempts = attempts;
        return this;
    }

    public Map<Column, Object> getValues() {
        return Collections.unmodifiableMap(values);
    }

    public JobState getExpectedState() {
        return expectedState;
    }

    public Integer getExpectedAttempts() {
        return expectedAttempts;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        return "JobUpdate" + values
                + (expectedState != null ? " whereState=" + expectedState : "")
                + (expectedAttempts != null ? " whereAttempts=" + expectedAttempts : "");
    }
}
