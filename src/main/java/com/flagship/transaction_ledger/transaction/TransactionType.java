package com.flagship.transaction_ledger.transaction;

import java.util.Locale;

/**
 * Type of a transaction record in the input log.
 *
 * Deposits and withdrawals carry an amount and can be referenced later.
 * The dispute family (dispute, resolve, chargeback) carries no amount of its own:
 * it points back to a deposit or withdrawal through the shared tx id.
 */
public enum TransactionType {
    /**
     * Credits the client's available and total funds.
     */
    DEPOSIT,

    /**
     * Debits available and total funds when enough funds are available.
     */
    WITHDRAWAL,

    /**
     * Moves the referenced amount from available to held.
     */
    DISPUTE,

    /**
     * Moves the referenced amount back from held to available.
     */
    RESOLVE,

    /**
     * Removes the referenced amount from held and total, then locks the account.
     * Terminal for the account: the lock is never lifted.
     */
    CHARGEBACK;

    /**
     * True for the types that are kept in the reference index and can be
     * pointed at by the dispute family.
     */
    public boolean isReferenceable() {
        return this == DEPOSIT || this == WITHDRAWAL;
    }

    /**
     * Parses the lowercase code used in the input log. Matching ignores case.
     *
     * @throws IllegalArgumentException if the code names no known type
     */
    public static TransactionType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Transaction type is required");
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown transaction type: " + code, e);
        }
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
