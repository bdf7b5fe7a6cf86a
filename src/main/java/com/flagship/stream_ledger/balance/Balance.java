package com.flagship.stream_ledger.balance;

import lombok.Value;

/**
 * Native-currency balance held by a stream, in base units.
 *
 * Key invariants:
 * - The value is never negative, not even transiently
 * - Deposits are overflow-checked
 * - Withdrawals are all-or-nothing
 *
 * Instances are immutable; every operation returns a new Balance.
 */
@Value
public class Balance {

    private static final Balance ZERO = new Balance(0L);

    long value;

    private Balance(long value) {
        this.value = value;
    }

    public static Balance zero() {
        return ZERO;
    }

    /**
     * Restores a balance from a persisted value.
     *
     * @throws IllegalArgumentException if the value is negative
     */
    public static Balance of(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Balance cannot be negative: " + value);
        }
        return value == 0 ? ZERO : new Balance(value);
    }

    /**
     * Adds the full amount to this balance.
     *
     * @param amount Amount to merge in, must not be negative
     * @return New balance including the amount
     * @throws IllegalArgumentException if the amount is negative
     * @throws IllegalStateException if the result would overflow
     */
    public Balance deposit(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Deposit amount cannot be negative: " + amount);
        }
        try {
            return of(Math.addExact(value, amount));
        } catch (ArithmeticException e) {
            throw new IllegalStateException(
                String.format("Deposit of %d would overflow balance of %d", amount, value), e);
        }
    }

    /**
     * Removes exactly the given amount, or nothing at all.
     *
     * @param amount Amount to withdraw, must not be negative
     * @return New balance without the amount
     * @throws IllegalStateException if the balance does not cover the amount
     */
    public Balance withdraw(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Withdrawal amount cannot be negative: " + amount);
        }
        if (amount > value) {
            throw new IllegalStateException(
                String.format("Cannot withdraw %d from balance of %d", amount, value));
        }
        return of(value - amount);
    }

    /**
     * Withdraws the entire balance.
     */
    public Withdrawal withdrawAll() {
        return new Withdrawal(value, withdraw(value));
    }

    public boolean isZero() {
        return value == 0;
    }

    /**
     * Result of withdrawing a whole balance: the amount taken out and what remains.
     */
    @Value
    public static class Withdrawal {
        long amount;
        Balance remaining;
    }
}
