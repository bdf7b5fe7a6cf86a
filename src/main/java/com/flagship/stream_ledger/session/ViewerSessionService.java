package com.flagship.stream_ledger.session;

import com.flagship.stream_ledger.exception.NotFoundException;
import com.flagship.stream_ledger.exception.StreamLedgerException;
import com.flagship.stream_ledger.ledger.RevenueLedger;
import com.flagship.stream_ledger.observability.CorrelationContext;
import com.flagship.stream_ledger.observability.StreamMetrics;
import com.flagship.stream_ledger.outbox.OutboxService;
import com.flagship.stream_ledger.stream.Stream;
import com.flagship.stream_ledger.stream.StreamPersistenceService;
import com.flagship.stream_ledger.stream.event.StreamEvent;
import com.flagship.stream_ledger.stream.event.TipSentEvent;
import com.flagship.stream_ledger.stream.event.ViewerJoinedEvent;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Viewer-side entry points: joining a stream, heartbeats and tips.
 *
 * Each entry point is one transaction. Stream and session rows are locked
 * for the whole call, always session first and stream second.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ViewerSessionService {

    private final ViewerSessionRepository sessionRepository;
    private final StreamPersistenceService streamPersistenceService;
    private final RevenueLedger revenueLedger;
    private final OutboxService outboxService;
    private final StreamMetrics streamMetrics;
    private final Clock clock;

    /**
     * Admits the caller to a live stream and opens their session.
     *
     * @param payment Amount offered, or null for none
     * @return the new session and any amount handed back to the viewer
     * @throws com.flagship.stream_ledger.exception.InvalidStateException if the stream is not LIVE
     * @throws com.flagship.stream_ledger.exception.InsufficientPaymentException if the payment is below the price
     * @throws IllegalStateException if the deposit would overflow the stream balance
     */
    @Transactional
    public JoinResult join(UUID streamId, String viewer, Long payment) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.STREAM_ID_MDC_KEY, streamId.toString());

        try {
            Stream stream = streamPersistenceService.lockById(streamId);
            Stream.Admission admission = stream.admit(payment);
            streamPersistenceService.update(admission.getStream());

            long now = clock.millis();
            ViewerSession session = ViewerSession.open(UUID.randomUUID(), streamId, viewer, admission.isPaid(), now);
            sessionRepository.save(ViewerSessionEntity.fromDomain(session));
            MDC.put(CorrelationContext.SESSION_ID_MDC_KEY, session.getId().toString());

            if (admission.getDeposited() > 0) {
                revenueLedger.recordDeposit(streamId, viewer, admission.getDeposited(), "subscription");
                streamMetrics.recordDeposit("subscription", admission.getDeposited());
            }

            outboxService.saveEvent(StreamEvent.AGGREGATE_TYPE, streamId,
                ViewerJoinedEvent.EVENT_TYPE, ViewerJoinedEvent.fromSession(session, admission.getDeposited()));

            long duration = System.currentTimeMillis() - startTime;
            streamMetrics.recordJoin(admission.isPaid());
            streamMetrics.recordLatency("join", duration);

            log.info("Viewer joined: viewer={}, paid={}, deposited={}, refunded={}, viewerCount={}, duration={}ms",
                viewer, admission.isPaid(), admission.getDeposited(), admission.getRefunded(),
                admission.getStream().getViewerCount(), duration);

            return new JoinResult(session, admission.getStream(), admission.getRefunded());

        } catch (StreamLedgerException | IllegalArgumentException | IllegalStateException e) {
            streamMetrics.recordLatency("join", System.currentTimeMillis() - startTime);
            log.warn("Join rejected: viewer={}, error={}", viewer, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            streamMetrics.recordLatency("join", System.currentTimeMillis() - startTime);
            log.error("Join failed: viewer={}, error={}", viewer, e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.STREAM_ID_MDC_KEY);
            MDC.remove(CorrelationContext.SESSION_ID_MDC_KEY);
        }
    }

    /**
     * Adds the time since the last heartbeat to the session and records the quality tier.
     *
     * @throws com.flagship.stream_ledger.exception.NotAuthorizedException if the caller does not own the session
     * @throws com.flagship.stream_ledger.exception.InvalidQualityException if the tier is unsupported
     */
    @Transactional
    public ViewerSession heartbeat(UUID sessionId, String caller, int quality) {
        MDC.put(CorrelationContext.SESSION_ID_MDC_KEY, sessionId.toString());

        try {
            ViewerSessionEntity entity = lockSession(sessionId);
            ViewerSession updated = entity.toDomain().heartbeat(caller, quality, clock.millis());
            entity.updateFromDomain(updated);
            sessionRepository.save(entity);

            streamMetrics.recordHeartbeat();
            log.debug("Heartbeat: quality={}, totalWatchTime={}ms", quality, updated.getTotalWatchTime());
            return updated;

        } catch (StreamLedgerException e) {
            log.warn("Heartbeat rejected: caller={}, error={}", caller, e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.SESSION_ID_MDC_KEY);
        }
    }

    /**
     * Deposits a tip from the session's viewer into the stream's balance.
     *
     * @throws com.flagship.stream_ledger.exception.NotAuthorizedException if the caller does not own the session
     * @throws IllegalArgumentException if the session belongs to another stream or the amount is not positive
     * @throws com.flagship.stream_ledger.exception.InvalidStateException if the stream does not accept tips
     * @throws IllegalStateException if the tip would overflow the stream balance
     */
    @Transactional
    public TipResult tip(UUID streamId, UUID sessionId, String caller, long amount, String message) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.STREAM_ID_MDC_KEY, streamId.toString());
        MDC.put(CorrelationContext.SESSION_ID_MDC_KEY, sessionId.toString());

        try {
            ViewerSessionEntity sessionEntity = lockSession(sessionId);
            ViewerSession session = sessionEntity.toDomain();
            session.requireOwner(caller);
            if (!session.getStreamId().equals(streamId)) {
                throw new IllegalArgumentException(
                    String.format("Viewer session %s does not belong to stream %s", sessionId, streamId));
            }

            Stream stream = streamPersistenceService.lockById(streamId);
            Stream tipped = stream.receiveTip(amount);
            streamPersistenceService.update(tipped);

            ViewerSession updatedSession = session.recordTip(amount);
            sessionEntity.updateFromDomain(updatedSession);
            sessionRepository.save(sessionEntity);

            revenueLedger.recordDeposit(streamId, caller, amount, "tip");

            outboxService.saveEvent(StreamEvent.AGGREGATE_TYPE, streamId,
                TipSentEvent.EVENT_TYPE, TipSentEvent.of(tipped, updatedSession, amount, message, clock.millis()));

            long duration = System.currentTimeMillis() - startTime;
            streamMetrics.recordTip(amount);
            streamMetrics.recordDeposit("tip", amount);
            streamMetrics.recordLatency("tip", duration);

            log.info("Tip sent: sender={}, amount={}, balance={}, duration={}ms",
                caller, amount, tipped.getBalance().getValue(), duration);

            return new TipResult(updatedSession, tipped);

        } catch (StreamLedgerException | IllegalArgumentException | IllegalStateException e) {
            streamMetrics.recordLatency("tip", System.currentTimeMillis() - startTime);
            log.warn("Tip rejected: sender={}, error={}", caller, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            streamMetrics.recordLatency("tip", System.currentTimeMillis() - startTime);
            log.error("Tip failed: sender={}, error={}", caller, e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.STREAM_ID_MDC_KEY);
            MDC.remove(CorrelationContext.SESSION_ID_MDC_KEY);
        }
    }

    /**
     * @throws NotFoundException if no such session exists
     */
    @Transactional(readOnly = true)
    public ViewerSession getSession(UUID sessionId) {
        return sessionRepository.findById(sessionId)
            .map(ViewerSessionEntity::toDomain)
            .orElseThrow(() -> NotFoundException.session(sessionId));
    }

    private ViewerSessionEntity lockSession(UUID sessionId) {
        return sessionRepository.findByIdForUpdate(sessionId)
            .orElseThrow(() -> NotFoundException.session(sessionId));
    }

    @Value
    public static class JoinResult {
        ViewerSession session;
        Stream stream;
        long refundedAmount;
    }

    @Value
    public static class TipResult {
        ViewerSession session;
        Stream stream;
    }
}
