package com.flagship.transaction_ledger.ledger;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Balance state of one client.
 *
 * Unlike the immutable transaction records, an account is mutated in place by
 * the settlement engine while a run replays the log.
 *
 * Key invariant: total == available + held after every operation below.
 * Available funds may go negative through disputes; callers decide whether an
 * operation is allowed, this class only keeps the three balances consistent.
 */
@Getter
@ToString
public class ClientAccount {

    private final int clientId;
    private BigDecimal available = BigDecimal.ZERO;
    private BigDecimal held = BigDecimal.ZERO;
    private BigDecimal total = BigDecimal.ZERO;
    private boolean locked;

    private ClientAccount(int clientId) {
        this.clientId = clientId;
    }

    /**
     * Opens an empty, unlocked account.
     */
    public static ClientAccount open(int clientId) {
        if (clientId < 0 || clientId > 0xFFFF) {
            throw new IllegalArgumentException("Client id out of range: " + clientId);
        }
        return new ClientAccount(clientId);
    }

    public boolean hasAvailable(BigDecimal amount) {
        return available.compareTo(amount) >= 0;
    }

    /**
     * Adds funds to available and total.
     */
    public void credit(BigDecimal amount) {
        available = available.add(amount);
        total = total.add(amount);
    }

    /**
     * Removes funds from available and total. No funds check.
     */
    public void debit(BigDecimal amount) {
        available = available.subtract(amount);
        total = total.subtract(amount);
    }

    /**
     * Moves funds from available to held.
     */
    public void hold(BigDecimal amount) {
        available = available.subtract(amount);
        held = held.add(amount);
    }

    /**
     * Moves funds from held back to available.
     */
    public void release(BigDecimal amount) {
        held = held.subtract(amount);
        available = available.add(amount);
    }

    /**
     * Removes held funds from the account and locks it for good.
     */
    public void chargeBack(BigDecimal amount) {
        held = held.subtract(amount);
        total = total.subtract(amount);
        locked = true;
    }

    public boolean isBalanced() {
        return total.compareTo(available.add(held)) == 0;
    }
}
