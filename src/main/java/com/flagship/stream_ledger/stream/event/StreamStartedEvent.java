package com.flagship.stream_ledger.stream.event;

import com.flagship.stream_ledger.stream.Stream;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class StreamStartedEvent implements StreamEvent {
    UUID eventId;
    UUID streamId;
    String creator;
    String manifestRef;
    Instant occurredAt;

    public static final String EVENT_TYPE = "StreamStarted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static StreamStartedEvent fromStream(Stream stream) {
        return new StreamStartedEvent(
            UUID.randomUUID(),
            stream.getId(),
            stream.getCreator(),
            stream.getManifestRef(),
            Instant.ofEpochMilli(stream.getStartedAt())
        );
    }
}
