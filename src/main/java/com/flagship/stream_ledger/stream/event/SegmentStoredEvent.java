package com.flagship.stream_ledger.stream.event;

import com.flagship.stream_ledger.stream.Segment;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class SegmentStoredEvent implements StreamEvent {
    UUID eventId;
    UUID streamId;
    long segmentNumber;
    String blobRef;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SegmentStored";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SegmentStoredEvent fromSegment(Segment segment) {
        return new SegmentStoredEvent(
            UUID.randomUUID(),
            segment.getStreamId(),
            segment.getSegmentNumber(),
            segment.getBlobRef(),
            Instant.ofEpochMilli(segment.getStoredAt())
        );
    }
}
