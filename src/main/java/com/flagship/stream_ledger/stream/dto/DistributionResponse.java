package com.flagship.stream_ledger.stream.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.stream_ledger.stream.RevenueDistributionService;
import lombok.Value;

import java.util.UUID;

@Value
public class DistributionResponse {

    @JsonProperty("stream_id")
    UUID streamId;

    @JsonProperty("creator")
    String creator;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("revenue_balance")
    long revenueBalance;

    @JsonProperty("ledger_transaction_id")
    UUID ledgerTransactionId;

    public static DistributionResponse from(RevenueDistributionService.Distribution distribution) {
        return new DistributionResponse(
            distribution.getStream().getId(),
            distribution.getStream().getCreator(),
            distribution.getAmount(),
            distribution.getStream().getBalance().getValue(),
            distribution.getLedgerTransactionId()
        );
    }
}
