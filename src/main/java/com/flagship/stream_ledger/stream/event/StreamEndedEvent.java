package com.flagship.stream_ledger.stream.event;

import com.flagship.stream_ledger.stream.Stream;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Snapshot of a broadcast at the moment it ended. totalRevenue is the
 * undistributed balance at that moment, not lifetime earnings.
 */
@Value
public class StreamEndedEvent implements StreamEvent {
    UUID eventId;
    UUID streamId;
    long durationMillis;
    long viewerCount;
    long totalRevenue;
    Instant occurredAt;

    public static final String EVENT_TYPE = "StreamEnded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static StreamEndedEvent fromStream(Stream stream) {
        return new StreamEndedEvent(
            UUID.randomUUID(),
            stream.getId(),
            stream.getDurationMillis(),
            stream.getViewerCount(),
            stream.getBalance().getValue(),
            Instant.ofEpochMilli(stream.getEndedAt())
        );
    }
}
