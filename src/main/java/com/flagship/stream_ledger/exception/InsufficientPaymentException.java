package com.flagship.stream_ledger.exception;

public class InsufficientPaymentException extends StreamLedgerException {

    public InsufficientPaymentException(long payment, long price) {
        super(ErrorCode.INSUFFICIENT_PAYMENT,
                String.format("Payment of %d is below the subscription price of %d", payment, price));
    }
}
