package com.flagship.stream_ledger.stream.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.stream_ledger.stream.Stream;
import com.flagship.stream_ledger.stream.StreamStatus;
import lombok.Value;

import java.util.UUID;

/**
 * The manifest reference is empty until the stream goes live.
 */
@Value
public class ManifestResponse {

    @JsonProperty("stream_id")
    UUID streamId;

    @JsonProperty("manifest_ref")
    String manifestRef;

    @JsonProperty("status")
    StreamStatus status;

    public static ManifestResponse from(Stream stream) {
        return new ManifestResponse(stream.getId(), stream.getManifestRef(), stream.getStatus());
    }
}
