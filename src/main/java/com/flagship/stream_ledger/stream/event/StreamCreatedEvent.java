package com.flagship.stream_ledger.stream.event;

import com.flagship.stream_ledger.stream.Stream;
import lombok.Value;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

@Value
public class StreamCreatedEvent implements StreamEvent {
    UUID eventId;
    UUID streamId;
    String creator;
    String title;
    String category;
    Set<Integer> qualityLevels;
    boolean monetized;
    long subscriptionPrice;
    boolean tipEnabled;
    Instant occurredAt;

    public static final String EVENT_TYPE = "StreamCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static StreamCreatedEvent fromStream(Stream stream) {
        return new StreamCreatedEvent(
            UUID.randomUUID(),
            stream.getId(),
            stream.getCreator(),
            stream.getTitle(),
            stream.getCategory(),
            stream.getQualityLevels(),
            stream.isMonetized(),
            stream.getSubscriptionPrice(),
            stream.isTipEnabled(),
            Instant.ofEpochMilli(stream.getCreatedAt())
        );
    }
}
