package com.flagship.stream_ledger.ledger;

/**
 * Represents the type of ledger entry in double-entry accounting.
 * Every transaction must have balanced debits and credits.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
