package com.flagship.transaction_ledger.settlement;

import java.util.Locale;

/**
 * Result of one settlement attempt.
 *
 * Only APPLIED changes the account. Every other value is a silent no-op:
 * it is logged and counted, never reported to the caller as an error.
 */
public enum SettlementOutcome {
    APPLIED,

    /**
     * The deposit or withdrawal, or the referenced record, has no amount.
     */
    MISSING_AMOUNT,

    /**
     * Withdrawal larger than the available funds.
     */
    INSUFFICIENT_FUNDS,

    /**
     * Dispute family settled without a referenced record.
     */
    MISSING_REFERENCE,

    /**
     * Account already locked and locked accounts are configured to reject settlement.
     */
    ACCOUNT_LOCKED;

    public boolean isApplied() {
        return this == APPLIED;
    }

    public String tagValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
