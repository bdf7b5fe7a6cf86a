package com.flagship.stream_ledger.exception;

public class InvalidStateException extends StreamLedgerException {

    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }
}
