package com.flagship.stream_ledger.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.stream_ledger.session.ViewerSessionService;
import lombok.Value;

import java.util.UUID;

@Value
public class TipResponse {

    @JsonProperty("stream_id")
    UUID streamId;

    @JsonProperty("session_id")
    UUID sessionId;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("tips_sent")
    long tipsSent;

    @JsonProperty("revenue_balance")
    long revenueBalance;

    public static TipResponse from(ViewerSessionService.TipResult result, long amount) {
        return new TipResponse(
            result.getStream().getId(),
            result.getSession().getId(),
            amount,
            result.getSession().getTipsSent(),
            result.getStream().getBalance().getValue()
        );
    }
}
