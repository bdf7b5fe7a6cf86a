package com.flagship.stream_ledger.session;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Entity
@Table(
    name = "viewer_sessions",
    indexes = @Index(name = "idx_viewer_sessions_stream", columnList = "stream_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ViewerSessionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "stream_id", nullable = false, updatable = false)
    private UUID streamId;

    @Column(nullable = false, updatable = false, length = 100)
    private String viewer;

    @Column(name = "started_at", nullable = false, updatable = false)
    private long startedAt;

    @Column(name = "last_heartbeat", nullable = false)
    private long lastHeartbeat;

    @Column(name = "total_watch_time", nullable = false)
    private long totalWatchTime;

    @Column(name = "quality_level", nullable = false)
    private int qualityLevel;

    @Column(name = "has_paid", nullable = false, updatable = false)
    private boolean hasPaid;

    @Column(name = "tips_sent", nullable = false)
    private long tipsSent;

    @Version
    @Column(nullable = false)
    private long version;

    static ViewerSessionEntity fromDomain(ViewerSession session) {
        ViewerSessionEntity entity = new ViewerSessionEntity();
        entity.id = session.getId();
        entity.streamId = session.getStreamId();
        entity.viewer = session.getViewer();
        entity.startedAt = session.getStartedAt();
        entity.hasPaid = session.isHasPaid();
        entity.updateFromDomain(session);
        return entity;
    }

    public ViewerSession toDomain() {
        return ViewerSession.builder()
            .id(id)
            .streamId(streamId)
            .viewer(viewer)
            .startedAt(startedAt)
            .lastHeartbeat(lastHeartbeat)
            .totalWatchTime(totalWatchTime)
            .qualityLevel(qualityLevel)
            .hasPaid(hasPaid)
            .tipsSent(tipsSent)
            .build();
    }

    /**
     * Copies the engagement counters. Ownership and payment status are fixed at join.
     */
    void updateFromDomain(ViewerSession session) {
        this.lastHeartbeat = session.getLastHeartbeat();
        this.totalWatchTime = session.getTotalWatchTime();
        this.qualityLevel = session.getQualityLevel();
        this.tipsSent = session.getTipsSent();
    }
}
