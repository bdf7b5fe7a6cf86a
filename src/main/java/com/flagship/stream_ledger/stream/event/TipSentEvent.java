package com.flagship.stream_ledger.stream.event;

import com.flagship.stream_ledger.session.ViewerSession;
import com.flagship.stream_ledger.stream.Stream;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class TipSentEvent implements StreamEvent {
    UUID eventId;
    UUID streamId;
    UUID sessionId;
    String sender;
    String creator;
    long amount;
    String message;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TipSent";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TipSentEvent of(Stream stream, ViewerSession session, long amount, String message, long now) {
        return new TipSentEvent(
            UUID.randomUUID(),
            stream.getId(),
            session.getId(),
            session.getViewer(),
            stream.getCreator(),
            amount,
            message,
            Instant.ofEpochMilli(now)
        );
    }
}
