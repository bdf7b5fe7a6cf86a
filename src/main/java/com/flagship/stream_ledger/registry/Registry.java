package com.flagship.stream_ledger.registry;

import lombok.Value;

/**
 * Platform-wide stream counters.
 *
 * Invariant: 0 ≤ activeStreams ≤ totalStreams. Every stream counts once in
 * totalStreams for its whole life; activeStreams counts the streams that are
 * LIVE right now.
 */
@Value
public class Registry {
    long totalStreams;
    long activeStreams;

    public static Registry empty() {
        return new Registry(0L, 0L);
    }

    public Registry recordCreated() {
        return new Registry(Math.addExact(totalStreams, 1L), activeStreams);
    }

    /**
     * @throws IllegalStateException if every known stream is already counted as active
     */
    public Registry recordStarted() {
        if (activeStreams >= totalStreams) {
            throw new IllegalStateException(
                String.format("Active stream count %d cannot exceed total %d", activeStreams + 1, totalStreams));
        }
        return new Registry(totalStreams, activeStreams + 1);
    }

    /**
     * @throws IllegalStateException if no stream is counted as active
     */
    public Registry recordEnded() {
        if (activeStreams == 0) {
            throw new IllegalStateException("Active stream count cannot go below zero");
        }
        return new Registry(totalStreams, activeStreams - 1);
    }
}
