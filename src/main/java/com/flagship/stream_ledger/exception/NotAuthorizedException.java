package com.flagship.stream_ledger.exception;

public class NotAuthorizedException extends StreamLedgerException {

    public NotAuthorizedException(String message) {
        super(ErrorCode.NOT_AUTHORIZED, message);
    }
}
