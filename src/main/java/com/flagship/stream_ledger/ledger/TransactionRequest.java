package com.flagship.stream_ledger.ledger;

import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * Request object for posting a transaction.
 * Contains debits and credits that must balance.
 *
 * Invariant: Sum of debits must equal sum of credits.
 */
@Value
public class TransactionRequest {
    String description;
    List<DebitCredit> debits;
    List<DebitCredit> credits;

    /**
     * Moves an amount from one owner's account to another's.
     */
    public static TransactionRequest transfer(String description,
                                              String fromOwner, Account.AccountType fromType,
                                              String toOwner, Account.AccountType toType,
                                              long amount) {
        return new TransactionRequest(
            description,
            List.of(DebitCredit.of(fromOwner, fromType, amount, description)),
            List.of(DebitCredit.of(toOwner, toType, amount, description))
        );
    }

    public boolean isBalanced() {
        return getDebitTotal() == getCreditTotal();
    }

    public long getDebitTotal() {
        return debits.stream()
            .mapToLong(DebitCredit::getAmount)
            .reduce(0L, Math::addExact);
    }

    public long getCreditTotal() {
        return credits.stream()
            .mapToLong(DebitCredit::getAmount)
            .reduce(0L, Math::addExact);
    }

    /**
     * Represents a single debit or credit against an owner's account.
     */
    @Value
    public static class DebitCredit {
        String owner;
        Account.AccountType accountType;
        long amount;
        String description;

        private DebitCredit(String owner, Account.AccountType accountType, long amount, String description) {
            this.owner = Objects.requireNonNull(owner);
            this.accountType = Objects.requireNonNull(accountType);
            if (amount <= 0) {
                throw new IllegalArgumentException("Amount must be positive");
            }
            this.amount = amount;
            this.description = description;
        }

        public static DebitCredit of(String owner, Account.AccountType accountType, long amount, String description) {
            return new DebitCredit(owner, accountType, amount, description);
        }
    }
}
