package com.flagship.stream_ledger.exception;

public class InvalidQualityException extends StreamLedgerException {

    public InvalidQualityException(int tier, int maxTier) {
        super(ErrorCode.INVALID_QUALITY,
                String.format("Quality tier %d is not supported. Tiers must be between 0 and %d.", tier, maxTier));
    }
}
