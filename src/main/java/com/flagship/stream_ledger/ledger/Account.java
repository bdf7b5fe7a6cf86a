package com.flagship.stream_ledger.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * An account in the payout ledger.
 *
 * Wallet accounts belong to an address (viewer or creator). Revenue pool
 * accounts mirror a stream's revenue balance.
 */
@Value
public class Account {
    UUID id;
    String owner;
    AccountType accountType;

    public enum AccountType {
        WALLET,
        REVENUE_POOL
    }

    public static String revenuePoolOwner(UUID streamId) {
        return "stream:" + streamId;
    }
}
