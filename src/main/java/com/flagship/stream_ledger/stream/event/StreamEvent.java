package com.flagship.stream_ledger.stream.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of every notification emitted by the stream entry points.
 *
 * Events are append-only facts. Consumers deduplicate on {@link #getEventId()}
 * because delivery is at least once.
 */
public interface StreamEvent {

    String AGGREGATE_TYPE = "Stream";

    UUID getEventId();

    /**
     * The stream this event is about; also the Kafka message key.
     */
    UUID getStreamId();

    Instant getOccurredAt();

    String getEventType();
}
