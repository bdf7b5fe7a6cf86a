package com.flagship.stream_ledger.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Records stream revenue movements in the payout ledger.
 *
 * Each stream has a revenue pool account whose derived balance always equals
 * the stream's revenue balance: deposits move funds from the payer's wallet
 * into the pool and a distribution moves the whole pool into the creator's wallet.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RevenueLedger {

    private final LedgerService ledgerService;

    /**
     * @param source what the deposit pays for, e.g. "subscription" or "tip"
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public UUID recordDeposit(UUID streamId, String payer, long amount, String source) {
        UUID transactionId = ledgerService.postTransaction(TransactionRequest.transfer(
            String.format("Stream %s %s from %s", streamId, source, payer),
            payer, Account.AccountType.WALLET,
            Account.revenuePoolOwner(streamId), Account.AccountType.REVENUE_POOL,
            amount
        ));
        log.debug("Posted {} deposit: streamId={}, amount={}, ledgerTxId={}", source, streamId, amount, transactionId);
        return transactionId;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public UUID recordPayout(UUID streamId, String creator, long amount) {
        UUID transactionId = ledgerService.postTransaction(TransactionRequest.transfer(
            String.format("Stream %s revenue payout to %s", streamId, creator),
            Account.revenuePoolOwner(streamId), Account.AccountType.REVENUE_POOL,
            creator, Account.AccountType.WALLET,
            amount
        ));
        log.debug("Posted payout: streamId={}, amount={}, ledgerTxId={}", streamId, amount, transactionId);
        return transactionId;
    }

    public long getRevenuePoolBalance(UUID streamId) {
        return ledgerService.getBalance(Account.revenuePoolOwner(streamId));
    }
}
