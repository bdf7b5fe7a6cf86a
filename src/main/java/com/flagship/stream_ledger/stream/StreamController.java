package com.flagship.stream_ledger.stream;

import com.flagship.stream_ledger.stream.dto.CreateStreamRequest;
import com.flagship.stream_ledger.stream.dto.DistributionResponse;
import com.flagship.stream_ledger.stream.dto.ManifestResponse;
import com.flagship.stream_ledger.stream.dto.ModerationScoreRequest;
import com.flagship.stream_ledger.stream.dto.SegmentResponse;
import com.flagship.stream_ledger.stream.dto.StartStreamRequest;
import com.flagship.stream_ledger.stream.dto.StoreSegmentRequest;
import com.flagship.stream_ledger.stream.dto.StreamResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for stream lifecycle, segment and revenue operations.
 *
 * Mutating calls identify the caller through the X-Caller-Address header,
 * set by the gateway after authentication.
 */
@RestController
@RequestMapping("/api/streams")
@RequiredArgsConstructor
@Slf4j
public class StreamController {

    public static final String CALLER_HEADER = "X-Caller-Address";

    private final StreamLifecycleService lifecycleService;
    private final RevenueDistributionService distributionService;

    @PostMapping
    public ResponseEntity<StreamResponse> createStream(
            @Valid @RequestBody CreateStreamRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {

        log.info("Received stream creation request: creator={}, title={}", caller, request.getTitle());
        Stream stream = lifecycleService.createStream(caller, request.toConfig());
        return ResponseEntity.status(HttpStatus.CREATED).body(StreamResponse.from(stream));
    }

    @GetMapping("/{id}")
    public ResponseEntity<StreamResponse> getStream(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(StreamResponse.from(lifecycleService.getStream(id)));
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<StreamResponse> startStream(
            @PathVariable("id") UUID id,
            @Valid @RequestBody StartStreamRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {

        return ResponseEntity.ok(StreamResponse.from(
            lifecycleService.startStream(id, caller, request.getManifestRef())));
    }

    @PostMapping("/{id}/end")
    public ResponseEntity<StreamResponse> endStream(
            @PathVariable("id") UUID id,
            @RequestHeader(CALLER_HEADER) String caller) {

        return ResponseEntity.ok(StreamResponse.from(lifecycleService.endStream(id, caller)));
    }

    @PostMapping("/{id}/archive")
    public ResponseEntity<StreamResponse> archiveStream(
            @PathVariable("id") UUID id,
            @RequestHeader(CALLER_HEADER) String caller) {

        return ResponseEntity.ok(StreamResponse.from(lifecycleService.archiveStream(id, caller)));
    }

    @GetMapping("/{id}/manifest")
    public ResponseEntity<ManifestResponse> getManifest(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(ManifestResponse.from(lifecycleService.getStream(id)));
    }

    @PutMapping("/{id}/segments/{segmentNumber}")
    public ResponseEntity<SegmentResponse> storeSegment(
            @PathVariable("id") UUID id,
            @PathVariable("segmentNumber") long segmentNumber,
            @Valid @RequestBody StoreSegmentRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {

        Segment segment = lifecycleService.storeSegment(id, caller, segmentNumber, request.getBlobRef());
        return ResponseEntity.ok(SegmentResponse.from(segment));
    }

    @GetMapping("/{id}/segments/{segmentNumber}")
    public ResponseEntity<SegmentResponse> getSegment(
            @PathVariable("id") UUID id,
            @PathVariable("segmentNumber") long segmentNumber) {

        return ResponseEntity.ok(SegmentResponse.from(lifecycleService.getSegment(id, segmentNumber)));
    }

    @PostMapping("/{id}/distribute")
    public ResponseEntity<DistributionResponse> distributeRevenue(
            @PathVariable("id") UUID id,
            @RequestHeader(CALLER_HEADER) String caller) {

        return ResponseEntity.ok(DistributionResponse.from(distributionService.distribute(id, caller)));
    }

    /**
     * Hook for the moderation collaborator; not restricted to the creator.
     */
    @PutMapping("/{id}/moderation-score")
    public ResponseEntity<StreamResponse> updateModerationScore(
            @PathVariable("id") UUID id,
            @Valid @RequestBody ModerationScoreRequest request) {

        return ResponseEntity.ok(StreamResponse.from(
            lifecycleService.updateModerationScore(id, request.getScore())));
    }
}
