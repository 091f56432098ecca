package com.queuectl.core;

/**
 * Enum representing the states a job moves through during its lifecycle.
 *
 * <p>State Transitions:</p>
 * <ul>
 *   <li>PENDING → PROCESSING: job acquired by a worker</li>
 *   <li>FAILED → PROCESSING: retry delay elapsed and a worker acquired the job again</li>
 *   <li>PROCESSING → COMPLETED: command exited successfully</li>
 *   <li>PROCESSING → FAILED: command failed, retry scheduled with backoff</li>
 *   <li>PROCESSING → DEAD: command failed and the retry budget is exhausted</li>
 *   <li>PROCESSING → PENDING: job released after its worker died</li>
 *   <li>DEAD → PENDING: job resurrected from the dead letter queue</li>
 * </ul>
 *
 * <p>The lower-case {@link #wireName()} is what gets stored in the {@code jobs.state}
 * column and what the command line accepts.</p>
 *
 * @see #canTransitionTo(JobState)
 */
public enum JobState {
    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed"),
    DEAD("dead");

    private final String wireName;

    JobState(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Get the name used for this state in the database and on the command line.
     *
     * @return the lower-case state name (e.g., "pending", "dead")
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Validate if a transition to a new state is legal.
     *
     * @param newState the target state
     * @return true if the transition is allowed by the lifecycle rules
     */
    public boolean canTransitionTo(JobState newState) {
        return switch (this) {
            case PENDING -> newState == PROCESSING;
            case FAILED -> newState == PROCESSING;
            case PROCESSING -> newState == COMPLETED || newState == FAILED
                    || newState == DEAD || newState == PENDING;
            case DEAD -> newState == PENDING;
            case COMPLETED -> false;
        };
    }

    /**
     * Resolve a state from its wire name, ignoring case.
     *
     * @param name the state name, e.g. "failed"
     * @return the matching state
     * @throws IllegalArgumentException if the name is not a known state
     */
    public static JobState fromWireName(String name) {
        if (name != null) {
            for (JobState state : values()) {
                if (state.wireName.equalsIgnoreCase(name.trim())) {
                    return state;
                }
            }
        }
        throw new IllegalArgumentException("Unknown job state: " + name
                + " (expected pending, processing, completed, failed or dead)");
    }

    @Override
    public String toString() {
        return wireName;
    }
}
