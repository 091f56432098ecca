package com.queuectl.engine;

import java.time.Duration;
import java.time.Instant;

/**
 * Exponential retry delay: {@code delay(attempt) = base ^ attempt} seconds.
 *
 * <ul>
 *   <li>base 2, attempt 1: 2 seconds</li>
 *   <li>base 2, attempt 2: 4 seconds</li>
 *   <li>base 2, attempt 3: 8 seconds</li>
 * </ul>
 *
 * <p>{@code attempt} is the 1-based count of failed attempts so far. There is no jitter,
 * so every worker computes the same retry time for the same failure.</p>
 */
public class BackoffPolicy {

    static final Duration MAX_DELAY = Duration.ofDays(365);

    private final double base;

    /**
     * @param base the exponent base, at least 1
     * @throws IllegalArgumentException if base is below 1 or not a number
     */
    public BackoffPolicy(double base) {
        if (Double.isNaN(base) || base < 1) {
            throw new IllegalArgumentException("Backoff base must be at least 1, got " + base);
        }
        this.base = base;
    }

    /**
     * Delay before the next attempt after {@code attempt} failures, capped at one year.
     *
     * @param attempt the number of failed attempts, starting at 1
     * @return the delay
     */
    public Duration delay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt must be at least 1, got " + attempt);
        }
        double seconds = Math.pow(base, attempt);
        if (Double.isInfinite(seconds) || seconds >= MAX_DELAY.getSeconds()) {
            return MAX_DELAY;
        }
        return Duration.ofMillis(Math.round(seconds * 1000));
    }

    /**
     * @return {@code now + delay(attempt)}
     */
    public Instant nextRetryAt(Instant now, int attempt) {
        return now.plus(delay(attempt));
    }

    public double getBase() {
        return base;
    }
}
