package com.flagship.stream_ledger.session;

import com.flagship.stream_ledger.exception.NotAuthorizedException;
import com.flagship.stream_ledger.stream.QualityLevel;
import com.flagship.stream_ledger.stream.Stream;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * One viewer's engagement with one stream, created by a join.
 *
 * Key invariants:
 * - Only the viewer who joined may touch the session
 * - totalWatchTime never decreases
 * - hasPaid is decided once, at join time
 * - tipsSent only grows
 */
@Value
@Builder(toBuilder = true)
public class ViewerSession {
    UUID id;
    UUID streamId;
    String viewer;
    long startedAt;
    long lastHeartbeat;
    long totalWatchTime;
    int qualityLevel;
    boolean hasPaid;
    long tipsSent;

    public static ViewerSession open(UUID id, UUID streamId, String viewer, boolean paid, long now) {
        Stream.requireAddress(viewer, "Viewer");
        return ViewerSession.builder()
            .id(id)
            .streamId(streamId)
            .viewer(viewer)
            .startedAt(now)
            .lastHeartbeat(now)
            .totalWatchTime(0L)
            .qualityLevel(QualityLevel.DEFAULT_TIER)
            .hasPaid(paid)
            .tipsSent(0L)
            .build();
    }

    /**
     * @throws NotAuthorizedException if the caller did not open this session
     */
    public void requireOwner(String caller) {
        if (caller == null || !caller.equals(viewer)) {
            throw new NotAuthorizedException(
                String.format("Caller %s does not own viewer session %s", caller, id));
        }
    }

    /**
     * Adds the time since the previous heartbeat to the watch time and records the current quality.
     *
     * A heartbeat dated before the previous one adds nothing.
     *
     * @throws NotAuthorizedException if the caller did not open this session
     * @throws com.flagship.stream_ledger.exception.InvalidQualityException if the tier is unsupported
     */
    public ViewerSession heartbeat(String caller, int quality, long now) {
        requireOwner(caller);
        QualityLevel.requireSupported(quality);
        long elapsed = Math.max(0L, now - lastHeartbeat);
        return toBuilder()
            .totalWatchTime(Math.addExact(totalWatchTime, elapsed))
            .lastHeartbeat(Math.max(now, lastHeartbeat))
            .qualityLevel(quality)
            .build();
    }

    public ViewerSession recordTip(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Tip amount must be positive");
        }
        return toBuilder()
            .tipsSent(Math.addExact(tipsSent, amount))
            .build();
    }
}
