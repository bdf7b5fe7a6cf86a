package com.flagship.stream_ledger.stream;

import lombok.Value;

import java.util.UUID;

/**
 * One entry in a stream's segment index: segment number to blob reference.
 */
@Value
public class Segment {
    UUID streamId;
    long segmentNumber;
    String blobRef;
    long storedAt;

    public static Segment of(UUID streamId, long segmentNumber, String blobRef, long storedAt) {
        if (segmentNumber < 0) {
            throw new IllegalArgumentException("Segment number cannot be negative");
        }
        if (blobRef == null || blobRef.isBlank()) {
            throw new IllegalArgumentException("Segment blob reference is required");
        }
        Stream.requireRefLength(blobRef, "Segment blob reference");
        return new Segment(streamId, segmentNumber, blobRef, storedAt);
    }
}
