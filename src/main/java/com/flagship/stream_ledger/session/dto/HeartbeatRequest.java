package com.flagship.stream_ledger.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class HeartbeatRequest {

    @NotNull(message = "Quality level is required")
    @JsonProperty("quality_level")
    Integer qualityLevel;
}
