package com.flagship.stream_ledger.stream;

import com.flagship.stream_ledger.exception.NotFoundException;
import com.flagship.stream_ledger.exception.StreamLedgerException;
import com.flagship.stream_ledger.observability.CorrelationContext;
import com.flagship.stream_ledger.observability.StreamMetrics;
import com.flagship.stream_ledger.outbox.OutboxService;
import com.flagship.stream_ledger.registry.RegistryService;
import com.flagship.stream_ledger.stream.event.SegmentStoredEvent;
import com.flagship.stream_ledger.stream.event.StreamCreatedEvent;
import com.flagship.stream_ledger.stream.event.StreamEndedEvent;
import com.flagship.stream_ledger.stream.event.StreamEvent;
import com.flagship.stream_ledger.stream.event.StreamStartedEvent;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Creator-side entry points that drive the stream state machine.
 *
 * Each entry point is one transaction: the stream row is locked first, the
 * registry row second, and the outbox event is written before commit. A
 * rejected call changes nothing and emits nothing.
 */
@Service
@Slf4j
public class StreamLifecycleService {

    private final StreamPersistenceService persistenceService;
    private final RegistryService registryService;
    private final OutboxService outboxService;
    private final StreamMetrics streamMetrics;
    private final Clock clock;
    private final String defaultCategory;

    public StreamLifecycleService(StreamPersistenceService persistenceService,
                                  RegistryService registryService,
                                  OutboxService outboxService,
                                  StreamMetrics streamMetrics,
                                  Clock clock,
                                  @Value("${stream-ledger.default-category:General}") String defaultCategory) {
        this.persistenceService = persistenceService;
        this.registryService = registryService;
        this.outboxService = outboxService;
        this.streamMetrics = streamMetrics;
        this.clock = clock;
        this.defaultCategory = defaultCategory;
    }

    /**
     * Creates a stream in CREATED status and adds it to the registry.
     *
     * @throws com.flagship.stream_ledger.exception.InvalidQualityException if a requested tier is unsupported
     * @throws IllegalArgumentException if the configuration is otherwise invalid
     */
    @Transactional
    public Stream createStream(String creator, StreamConfig config) {
        UUID streamId = UUID.randomUUID();
        return execute("create", streamId, () -> {
            StreamConfig resolved = config.getCategory() == null || config.getCategory().isBlank()
                ? config.toBuilder().category(defaultCategory).build()
                : config;

            Stream stream = persistenceService.save(Stream.create(streamId, creator, resolved, clock.millis()));
            registryService.recordStreamCreated(stream.getId(), stream.getCategory());

            outboxService.saveEvent(StreamEvent.AGGREGATE_TYPE, stream.getId(),
                StreamCreatedEvent.EVENT_TYPE, StreamCreatedEvent.fromStream(stream));

            log.info("Stream created: creator={}, category={}, monetized={}, price={}",
                creator, stream.getCategory(), stream.isMonetized(), stream.getSubscriptionPrice());
            return stream;
        });
    }

    /**
     * @throws com.flagship.stream_ledger.exception.NotAuthorizedException if the caller is not the creator
     * @throws com.flagship.stream_ledger.exception.InvalidStateException if the stream is not CREATED
     */
    @Transactional
    public Stream startStream(UUID streamId, String caller, String manifestRef) {
        return execute("start", streamId, () -> {
            Stream stream = persistenceService.lockById(streamId);
            Stream live = persistenceService.update(stream.start(caller, manifestRef, clock.millis()));
            registryService.recordStreamStarted();

            outboxService.saveEvent(StreamEvent.AGGREGATE_TYPE, streamId,
                StreamStartedEvent.EVENT_TYPE, StreamStartedEvent.fromStream(live));

            log.info("Stream started: startedAt={}, manifest={}", live.getStartedAt(), live.getManifestRef());
            return live;
        });
    }

    /**
     * Ends a live stream. Viewer count and balance stay as they are.
     *
     * @throws com.flagship.stream_ledger.exception.NotAuthorizedException if the caller is not the creator
     * @throws com.flagship.stream_ledger.exception.InvalidStateException if the stream is not LIVE
     */
    @Transactional
    public Stream endStream(UUID streamId, String caller) {
        return execute("end", streamId, () -> {
            Stream stream = persistenceService.lockById(streamId);
            Stream ended = persistenceService.update(stream.end(caller, clock.millis()));
            registryService.recordStreamEnded();

            outboxService.saveEvent(StreamEvent.AGGREGATE_TYPE, streamId,
                StreamEndedEvent.EVENT_TYPE, StreamEndedEvent.fromStream(ended));

            log.info("Stream ended: duration={}ms, viewers={}, revenue={}",
                ended.getDurationMillis(), ended.getViewerCount(), ended.getBalance().getValue());
            return ended;
        });
    }

    /**
     * Indexes a segment blob under its number. Storing a number twice replaces the earlier reference.
     *
     * @throws com.flagship.stream_ledger.exception.NotAuthorizedException if the caller is not the creator
     */
    @Transactional
    public Segment storeSegment(UUID streamId, String caller, long segmentNumber, String blobRef) {
        return execute("store_segment", streamId, () -> {
            Stream stream = persistenceService.lockById(streamId);
            stream.requireCreator(caller);

            Segment segment = persistenceService.saveSegment(
                Segment.of(streamId, segmentNumber, blobRef, clock.millis()));

            outboxService.saveEvent(StreamEvent.AGGREGATE_TYPE, streamId,
                SegmentStoredEvent.EVENT_TYPE, SegmentStoredEvent.fromSegment(segment));

            streamMetrics.recordSegmentStored();
            log.debug("Segment stored: number={}, blobRef={}", segmentNumber, blobRef);
            return segment;
        });
    }

    /**
     * Takes an ended stream out of circulation. Registry counters and the category index are untouched.
     *
     * @throws com.flagship.stream_ledger.exception.NotAuthorizedException if the caller is not the creator
     * @throws com.flagship.stream_ledger.exception.InvalidStateException if the stream is not ENDED
     */
    @Transactional
    public Stream archiveStream(UUID streamId, String caller) {
        return execute("archive", streamId, () -> {
            Stream stream = persistenceService.lockById(streamId);
            Stream archived = persistenceService.update(stream.archive(caller));
            log.info("Stream archived");
            return archived;
        });
    }

    /**
     * Stores the score reported by the moderation collaborator.
     *
     * @throws IllegalArgumentException if the score is outside 0..100
     */
    @Transactional
    public Stream updateModerationScore(UUID streamId, int score) {
        return execute("moderation_score", streamId, () -> {
            Stream stream = persistenceService.lockById(streamId);
            Stream updated = persistenceService.update(stream.withModerationScore(score));
            log.info("Moderation score updated: {} -> {}", stream.getModerationScore(), score);
            return updated;
        });
    }

    @Transactional(readOnly = true)
    public Stream getStream(UUID streamId) {
        return persistenceService.getById(streamId);
    }

    /**
     * @throws NotFoundException if the stream or the segment does not exist
     */
    @Transactional(readOnly = true)
    public Segment getSegment(UUID streamId, long segmentNumber) {
        persistenceService.getById(streamId);
        return persistenceService.findSegment(streamId, segmentNumber)
            .orElseThrow(() -> new NotFoundException(
                String.format("Segment %d not found for stream %s", segmentNumber, streamId)));
    }

    /**
     * Runs one entry point with the stream id in MDC and records its outcome and latency.
     */
    private <T> T execute(String operation, UUID streamId, Supplier<T> body) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.STREAM_ID_MDC_KEY, streamId.toString());

        try {
            T result = body.get();
            streamMetrics.recordTransition(operation, "success");
            return result;

        } catch (StreamLedgerException | IllegalArgumentException | IllegalStateException e) {
            streamMetrics.recordTransition(operation, "rejected");
            log.warn("Stream {} rejected: error={}", operation, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            streamMetrics.recordTransition(operation, "error");
            log.error("Stream {} failed: error={}", operation, e.getMessage());
            throw e;
        } finally {
            streamMetrics.recordLatency(operation, System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.STREAM_ID_MDC_KEY);
        }
    }
}
