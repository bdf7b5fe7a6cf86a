package com.flagship.stream_ledger.exception;

import java.util.UUID;

public class NotFoundException extends StreamLedgerException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public static NotFoundException stream(UUID streamId) {
        return new NotFoundException("Stream not found: " + streamId);
    }

    public static NotFoundException session(UUID sessionId) {
        return new NotFoundException("Viewer session not found: " + sessionId);
    }
}
