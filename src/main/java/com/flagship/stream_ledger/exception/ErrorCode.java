package com.flagship.stream_ledger.exception;

import org.springframework.http.HttpStatus;

/**
 * Error codes surfaced to callers when an entry point aborts.
 *
 * Every abort is terminal for the call. There is no transient/recoverable
 * distinction: the caller decides whether to retry.
 */
public enum ErrorCode {

    /**
     * Caller is not the stream creator or the session owner required by the operation.
     */
    NOT_AUTHORIZED(HttpStatus.FORBIDDEN),

    /**
     * Operation is not permitted from the current stream status.
     */
    INVALID_STATE(HttpStatus.CONFLICT),

    /**
     * Payment is below the stream's subscription price.
     */
    INSUFFICIENT_PAYMENT(HttpStatus.PAYMENT_REQUIRED),

    /**
     * Quality tier above the supported maximum.
     */
    INVALID_QUALITY(HttpStatus.BAD_REQUEST),

    NOT_FOUND(HttpStatus.NOT_FOUND);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
