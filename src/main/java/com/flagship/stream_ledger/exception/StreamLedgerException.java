package com.flagship.stream_ledger.exception;

/**
 * Base type for aborts that carry an {@link ErrorCode}.
 *
 * Thrown from inside an entry-point transaction, so the abort rolls back
 * every change the call made.
 */
public abstract class StreamLedgerException extends RuntimeException {

    private final ErrorCode errorCode;

    protected StreamLedgerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
