package com.flagship.stream_ledger.stream;

import com.flagship.stream_ledger.exception.StreamLedgerException;
import com.flagship.stream_ledger.ledger.RevenueLedger;
import com.flagship.stream_ledger.observability.CorrelationContext;
import com.flagship.stream_ledger.observability.StreamMetrics;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Pays a stream's accumulated revenue out to its creator.
 *
 * The stream balance is zeroed and the payout is posted to the ledger in the
 * same transaction, so the creator's wallet grows by exactly what the stream
 * loses. Revenue splits are not applied.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RevenueDistributionService {

    private final StreamPersistenceService persistenceService;
    private final RevenueLedger revenueLedger;
    private final StreamMetrics streamMetrics;

    /**
     * Withdraws the entire balance to the creator. A zero balance is a successful no-op.
     *
     * @throws com.flagship.stream_ledger.exception.NotAuthorizedException if the caller is not the creator
     */
    @Transactional
    public Distribution distribute(UUID streamId, String caller) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.STREAM_ID_MDC_KEY, streamId.toString());

        try {
            Stream stream = persistenceService.lockById(streamId);
            Stream.Payout payout = stream.distribute(caller);

            if (payout.isEmpty()) {
                log.info("Nothing to distribute: balance is zero");
                return new Distribution(stream, 0L, null);
            }

            Stream drained = persistenceService.update(payout.getStream());
            UUID ledgerTransactionId = revenueLedger.recordPayout(streamId, stream.getCreator(), payout.getAmount());

            long duration = System.currentTimeMillis() - startTime;
            streamMetrics.recordDistribution(payout.getAmount());
            streamMetrics.recordLatency("distribute", duration);

            log.info("Revenue distributed: creator={}, amount={}, ledgerTxId={}, duration={}ms",
                stream.getCreator(), payout.getAmount(), ledgerTransactionId, duration);

            return new Distribution(drained, payout.getAmount(), ledgerTransactionId);

        } catch (StreamLedgerException e) {
            streamMetrics.recordLatency("distribute", System.currentTimeMillis() - startTime);
            log.warn("Distribution rejected: caller={}, error={}", caller, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            streamMetrics.recordLatency("distribute", System.currentTimeMillis() - startTime);
            log.error("Distribution failed: caller={}, error={}", caller, e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.STREAM_ID_MDC_KEY);
        }
    }

    /**
     * Outcome of a distribution. ledgerTransactionId is null when nothing was paid out.
     */
    @Value
    public static class Distribution {
        Stream stream;
        long amount;
        UUID ledgerTransactionId;
    }
}
