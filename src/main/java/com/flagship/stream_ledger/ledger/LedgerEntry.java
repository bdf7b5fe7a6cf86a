package com.flagship.stream_ledger.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * A single debit or credit line of a ledger transaction.
 *
 * Entries are immutable once written.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID transactionId;
    UUID accountId;
    long amount;
    EntryType entryType;
    String description;
}
