package com.flagship.stream_ledger.stream.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class StoreSegmentRequest {

    @NotBlank(message = "Blob reference is required")
    @Size(max = 255, message = "Blob reference must be at most 255 characters")
    @JsonProperty("blob_ref")
    String blobRef;
}
