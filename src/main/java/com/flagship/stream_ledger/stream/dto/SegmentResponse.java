package com.flagship.stream_ledger.stream.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.stream_ledger.stream.Segment;
import lombok.Value;

import java.util.UUID;

@Value
public class SegmentResponse {

    @JsonProperty("stream_id")
    UUID streamId;

    @JsonProperty("segment_number")
    long segmentNumber;

    @JsonProperty("blob_ref")
    String blobRef;

    @JsonProperty("stored_at")
    long storedAt;

    public static SegmentResponse from(Segment segment) {
        return new SegmentResponse(segment.getStreamId(), segment.getSegmentNumber(),
            segment.getBlobRef(), segment.getStoredAt());
    }
}
