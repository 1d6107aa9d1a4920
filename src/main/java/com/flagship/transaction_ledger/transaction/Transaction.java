package com.flagship.transaction_ledger.transaction;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Immutable transaction record read from the input log.
 *
 * Key invariants:
 * - client id fits the unsigned 16-bit range
 * - tx id fits the unsigned 32-bit range
 * - amount is optional; only deposits and withdrawals use it
 */
@Value
public class Transaction {

    public static final int MAX_CLIENT_ID = 0xFFFF;
    public static final long MAX_TX_ID = 0xFFFF_FFFFL;

    TransactionType type;
    int clientId;
    long txId;
    BigDecimal amount;

    private Transaction(TransactionType type, int clientId, long txId, BigDecimal amount) {
        if (type == null) {
            throw new IllegalArgumentException("Transaction type is required");
        }
        if (clientId < 0 || clientId > MAX_CLIENT_ID) {
            throw new IllegalArgumentException(
                String.format("Client id %d is outside 0..%d", clientId, MAX_CLIENT_ID));
        }
        if (txId < 0 || txId > MAX_TX_ID) {
            throw new IllegalArgumentException(
                String.format("Transaction id %d is outside 0..%d", txId, MAX_TX_ID));
        }
        this.type = type;
        this.clientId = clientId;
        this.txId = txId;
        this.amount = amount;
    }

    public static Transaction of(TransactionType type, int clientId, long txId, BigDecimal amount) {
        return new Transaction(type, clientId, txId, amount);
    }

    public static Transaction deposit(int clientId, long txId, BigDecimal amount) {
        return new Transaction(TransactionType.DEPOSIT, clientId, txId, amount);
    }

    public static Transaction withdrawal(int clientId, long txId, BigDecimal amount) {
        return new Transaction(TransactionType.WITHDRAWAL, clientId, txId, amount);
    }

    public static Transaction dispute(int clientId, long txId) {
        return new Transaction(TransactionType.DISPUTE, clientId, txId, null);
    }

    public static Transaction resolve(int clientId, long txId) {
        return new Transaction(TransactionType.RESOLVE, clientId, txId, null);
    }

    public static Transaction chargeback(int clientId, long txId) {
        return new Transaction(TransactionType.CHARGEBACK, clientId, txId, null);
    }

    /**
     * Amount of the record, absent when the input left it blank or unparseable.
     */
    public Optional<BigDecimal> getAmount() {
        return Optional.ofNullable(amount);
    }
}
