package com.flagship.stream_ledger.stream.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class StartStreamRequest {

    @NotBlank(message = "Manifest reference is required")
    @Size(max = 255, message = "Manifest reference must be at most 255 characters")
    @JsonProperty("manifest_ref")
    String manifestRef;
}
