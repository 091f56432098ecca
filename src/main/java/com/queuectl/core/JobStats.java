package com.queuectl.core;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-state job counts. Every state is present, with zero where no job is in it,
 * and {@link #getTotal()} is always the sum of the five counts.
 */
public final class JobStats {
    private final Map<JobState, Long> counts;

    public JobStats(Map<JobState, Long> rawCounts) {
        EnumMap<JobState, Long> filled = new EnumMap<>(JobState.class);
        for (JobState state : JobState.values()) {
            Long count = rawCounts.get(state);
            filled.put(state, count != null ? count : 0L);
        }
        this.counts = Collections.unmodifiableMap(filled);
    }

    public long get(JobState state) {
        return counts.get(state);
    }

    public long getTotal() {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }

    public Map<JobState, Long> asMap() {
        return counts;
    }

    @Override
    public String toString() {
        return "JobStats" + counts + " total=" + getTotal();
    }
}
