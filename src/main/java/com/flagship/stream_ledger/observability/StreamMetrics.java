package com.flagship.stream_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for the stream entry points.
 *
 * Counters:
 * - streams.lifecycle{transition, status}: create/start/end/archive outcomes
 * - streams.segments.stored
 * - sessions.joined{paid}
 * - sessions.heartbeats
 * - tips.sent, tips.amount
 * - revenue.deposited{source}, revenue.distributed
 * - requests.rejected{code}
 *
 * Timer:
 * - streams.latency{operation}
 */
@Component
public class StreamMetrics {

    private final MeterRegistry registry;

    public StreamMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransition(String transition, String status) {
        registry.counter("streams.lifecycle",
                "transition", sanitizeTag(transition),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordSegmentStored() {
        registry.counter("streams.segments.stored").increment();
    }

    public void recordJoin(boolean paid) {
        registry.counter("sessions.joined", "paid", String.valueOf(paid)).increment();
    }

    public void recordHeartbeat() {
        registry.counter("sessions.heartbeats").increment();
    }

    public void recordTip(long amount) {
        registry.counter("tips.sent").increment();
        registry.counter("tips.amount").increment(amount);
    }

    /**
     * @param source "subscription" or "tip"
     */
    public void recordDeposit(String source, long amount) {
        registry.counter("revenue.deposited", "source", sanitizeTag(source)).increment(amount);
    }

    public void recordDistribution(long amount) {
        registry.counter("revenue.distributions").increment();
        registry.counter("revenue.distributed").increment(amount);
    }

    /**
     * Records a request refused with the given error code.
     */
    public void recordRejection(String code) {
        registry.counter("requests.rejected", "code", sanitizeTag(code)).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("streams.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Keeps tag values short and free of special characters.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
