package com.flagship.stream_ledger.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

@Value
public class SendTipRequest {

    @NotNull(message = "Session ID is required")
    @JsonProperty("session_id")
    UUID sessionId;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    Long amount;

    @Size(max = 500, message = "Message must be at most 500 characters")
    @JsonProperty("message")
    String message;
}
