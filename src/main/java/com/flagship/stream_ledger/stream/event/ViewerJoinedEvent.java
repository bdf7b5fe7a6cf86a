package com.flagship.stream_ledger.stream.event;

import com.flagship.stream_ledger.session.ViewerSession;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ViewerJoinedEvent implements StreamEvent {
    UUID eventId;
    UUID streamId;
    UUID sessionId;
    String viewer;
    boolean paid;
    long paymentAmount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ViewerJoined";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ViewerJoinedEvent fromSession(ViewerSession session, long paymentAmount) {
        return new ViewerJoinedEvent(
            UUID.randomUUID(),
            session.getStreamId(),
            session.getId(),
            session.getViewer(),
            session.isHasPaid(),
            paymentAmount,
            Instant.ofEpochMilli(session.getStartedAt())
        );
    }
}
