package com.flagship.stream_ledger.stream.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class ModerationScoreRequest {

    @NotNull(message = "Score is required")
    @JsonProperty("score")
    Integer score;
}
