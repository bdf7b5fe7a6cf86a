package com.flagship.stream_ledger.session;

import com.flagship.stream_ledger.session.dto.HeartbeatRequest;
import com.flagship.stream_ledger.session.dto.JoinStreamRequest;
import com.flagship.stream_ledger.session.dto.JoinStreamResponse;
import com.flagship.stream_ledger.session.dto.SendTipRequest;
import com.flagship.stream_ledger.session.dto.SessionResponse;
import com.flagship.stream_ledger.session.dto.TipResponse;
import com.flagship.stream_ledger.stream.StreamController;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for viewer sessions: joining, heartbeats and tips.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class SessionController {

    private final ViewerSessionService sessionService;

    @PostMapping("/streams/{streamId}/sessions")
    public ResponseEntity<JoinStreamResponse> joinStream(
            @PathVariable("streamId") UUID streamId,
            @RequestBody(required = false) JoinStreamRequest request,
            @RequestHeader(StreamController.CALLER_HEADER) String caller) {

        Long payment = request != null ? request.getPayment() : null;
        log.info("Received join request: viewer={}, payment={}", caller, payment);

        ViewerSessionService.JoinResult result = sessionService.join(streamId, caller, payment);
        return ResponseEntity.status(HttpStatus.CREATED).body(JoinStreamResponse.from(result));
    }

    @PostMapping("/streams/{streamId}/tips")
    public ResponseEntity<TipResponse> sendTip(
            @PathVariable("streamId") UUID streamId,
            @Valid @RequestBody SendTipRequest request,
            @RequestHeader(StreamController.CALLER_HEADER) String caller) {

        ViewerSessionService.TipResult result = sessionService.tip(
            streamId, request.getSessionId(), caller, request.getAmount(), request.getMessage());
        return ResponseEntity.ok(TipResponse.from(result, request.getAmount()));
    }

    @PostMapping("/sessions/{id}/heartbeat")
    public ResponseEntity<SessionResponse> heartbeat(
            @PathVariable("id") UUID id,
            @Valid @RequestBody HeartbeatRequest request,
            @RequestHeader(StreamController.CALLER_HEADER) String caller) {

        return ResponseEntity.ok(SessionResponse.from(
            sessionService.heartbeat(id, caller, request.getQualityLevel())));
    }

    @GetMapping("/sessions/{id}")
    public ResponseEntity<SessionResponse> getSession(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(SessionResponse.from(sessionService.getSession(id)));
    }
}
