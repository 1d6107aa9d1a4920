package com.flagship.transaction_ledger.settlement;

import com.flagship.transaction_ledger.config.LedgerProperties;
import com.flagship.transaction_ledger.ledger.ClientAccount;
import com.flagship.transaction_ledger.observability.SettlementMetrics;
import com.flagship.transaction_ledger.transaction.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Applies a single transaction to a client account.
 *
 * Rules per type:
 * - DEPOSIT: available += amount, total += amount
 * - WITHDRAWAL: available -= amount, total -= amount, only if available >= amount
 * - DISPUTE: available -= ref amount, held += ref amount
 * - RESOLVE: held -= ref amount, available += ref amount
 * - CHARGEBACK: held -= ref amount, total -= ref amount, account locked
 *
 * Amounts for the dispute family are always re-read from the referenced deposit
 * or withdrawal, never from intermediate account state. Dispute state itself is
 * not tracked: a resolve without a dispute, or a second dispute, still applies.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementEngine {

    private final LedgerProperties properties;
    private final SettlementMetrics metrics;

    /**
     * Settles a transaction against an account, mutating the account in place.
     *
     * @param account The account owned by the transaction's client
     * @param transaction The transaction to apply
     * @param referenced The deposit or withdrawal a dispute family record points at;
     *                   ignored (and usually null) for deposits and withdrawals
     * @return APPLIED if balances changed, otherwise the reason nothing happened
     */
    public SettlementOutcome settle(ClientAccount account, Transaction transaction, Transaction referenced) {
        if (account == null || transaction == null) {
            throw new IllegalArgumentException("Account and transaction are required");
        }

        SettlementOutcome outcome = apply(account, transaction, referenced);
        metrics.recordSettlement(transaction.getType(), outcome);

        if (outcome.isApplied()) {
            log.debug("Settled {}: available={}, held={}, total={}, locked={}",
                    transaction.getType().code(), account.getAvailable(), account.getHeld(),
                    account.getTotal(), account.isLocked());
        } else {
            log.debug("Skipped {}: outcome={}", transaction.getType().code(), outcome);
        }
        return outcome;
    }

    private SettlementOutcome apply(ClientAccount account, Transaction transaction, Transaction referenced) {
        if (account.isLocked() && properties.getSettlement().isRejectLockedAccounts()) {
            return SettlementOutcome.ACCOUNT_LOCKED;
        }

        return switch (transaction.getType()) {
            case DEPOSIT -> deposit(account, transaction);
            case WITHDRAWAL -> withdraw(account, transaction);
            case DISPUTE, RESOLVE, CHARGEBACK -> applyReferenced(account, transaction, referenced);
        };
    }

    private SettlementOutcome deposit(ClientAccount account, Transaction transaction) {
        Optional<BigDecimal> amount = transaction.getAmount();
        if (amount.isEmpty()) {
            return SettlementOutcome.MISSING_AMOUNT;
        }
        account.credit(amount.get());
        return SettlementOutcome.APPLIED;
    }

    private SettlementOutcome withdraw(ClientAccount account, Transaction transaction) {
        Optional<BigDecimal> amount = transaction.getAmount();
        if (amount.isEmpty()) {
            return SettlementOutcome.MISSING_AMOUNT;
        }
        if (!account.hasAvailable(amount.get())) {
            return SettlementOutcome.INSUFFICIENT_FUNDS;
        }
        account.debit(amount.get());
        return SettlementOutcome.APPLIED;
    }

    private SettlementOutcome applyReferenced(ClientAccount account, Transaction transaction, Transaction referenced) {
        if (referenced == null) {
            return SettlementOutcome.MISSING_REFERENCE;
        }
        if (referenced.getClientId() != transaction.getClientId()) {
            // Settled against the record's own client regardless
            metrics.incrementClientMismatch();
            log.warn("{} for client {} references tx {} owned by client {}",
                    transaction.getType().code(), transaction.getClientId(),
                    referenced.getTxId(), referenced.getClientId());
        }

        Optional<BigDecimal> amount = referenced.getAmount();
        if (amount.isEmpty()) {
            return SettlementOutcome.MISSING_AMOUNT;
        }

        switch (transaction.getType()) {
            case DISPUTE -> account.hold(amount.get());
            case RESOLVE -> account.release(amount.get());
            case CHARGEBACK -> account.chargeBack(amount.get());
            default -> throw new IllegalStateException(
                    "Not a referencing transaction type: " + transaction.getType());
        }
        return SettlementOutcome.APPLIED;
    }
}
