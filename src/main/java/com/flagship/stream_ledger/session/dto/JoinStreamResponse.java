package com.flagship.stream_ledger.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.stream_ledger.session.ViewerSessionService;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class JoinStreamResponse {

    @JsonProperty("session_id")
    UUID sessionId;

    @JsonProperty("stream_id")
    UUID streamId;

    @JsonProperty("viewer")
    String viewer;

    @JsonProperty("has_paid")
    boolean hasPaid;

    @JsonProperty("quality_level")
    int qualityLevel;

    @JsonProperty("viewer_count")
    long viewerCount;

    /**
     * Payment handed back untouched because the stream does not charge for access.
     */
    @JsonProperty("refunded_amount")
    long refundedAmount;

    public static JoinStreamResponse from(ViewerSessionService.JoinResult result) {
        return JoinStreamResponse.builder()
            .sessionId(result.getSession().getId())
            .streamId(result.getStream().getId())
            .viewer(result.getSession().getViewer())
            .hasPaid(result.getSession().isHasPaid())
            .qualityLevel(result.getSession().getQualityLevel())
            .viewerCount(result.getStream().getViewerCount())
            .refundedAmount(result.getRefundedAmount())
            .build();
    }
}
