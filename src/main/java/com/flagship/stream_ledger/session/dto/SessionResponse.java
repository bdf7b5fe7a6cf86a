package com.flagship.stream_ledger.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.stream_ledger.session.ViewerSession;
import com.flagship.stream_ledger.stream.QualityLevel;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class SessionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("stream_id")
    UUID streamId;

    @JsonProperty("viewer")
    String viewer;

    @JsonProperty("started_at")
    long startedAt;

    @JsonProperty("last_heartbeat")
    long lastHeartbeat;

    @JsonProperty("total_watch_time")
    long totalWatchTime;

    @JsonProperty("quality_level")
    int qualityLevel;

    @JsonProperty("quality_label")
    String qualityLabel;

    @JsonProperty("has_paid")
    boolean hasPaid;

    @JsonProperty("tips_sent")
    long tipsSent;

    public static SessionResponse from(ViewerSession session) {
        return SessionResponse.builder()
            .id(session.getId())
            .streamId(session.getStreamId())
            .viewer(session.getViewer())
            .startedAt(session.getStartedAt())
            .lastHeartbeat(session.getLastHeartbeat())
            .totalWatchTime(session.getTotalWatchTime())
            .qualityLevel(session.getQualityLevel())
            .qualityLabel(QualityLevel.fromTier(session.getQualityLevel())
                .map(QualityLevel::getLabel)
                .orElse(null))
            .hasPaid(session.isHasPaid())
            .tipsSent(session.getTipsSent())
            .build();
    }
}
