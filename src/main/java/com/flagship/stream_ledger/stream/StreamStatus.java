package com.flagship.stream_ledger.stream;

/**
 * Lifecycle status of a stream.
 *
 * The entry points drive CREATED → LIVE → ENDED. ARCHIVED is reached only
 * through the curation step after a stream has ended.
 */
public enum StreamStatus {
    /**
     * Stream has been registered but is not broadcasting yet.
     * Initial state for all streams.
     */
    CREATED,

    /**
     * Stream is broadcasting. Viewers can join and tip.
     */
    LIVE,

    /**
     * Broadcast is over. Balance and viewer count are kept as a historical snapshot.
     */
    ENDED,

    /**
     * Ended stream moved out of circulation by curation.
     * Terminal state - no further transitions allowed.
     */
    ARCHIVED
}
