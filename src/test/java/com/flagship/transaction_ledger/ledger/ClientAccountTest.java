package com.flagship.transaction_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class ClientAccountTest {

    @Test
    @DisplayName("New account is empty and unlocked")
    void testOpen() {
        ClientAccount account = ClientAccount.open(7);

        assertEquals(7, account.getClientId());
        assertEquals(0, account.getAvailable().signum());
        assertEquals(0, account.getHeld().signum());
        assertEquals(0, account.getTotal().signum());
        assertFalse(account.isLocked());
    }

    @Test
    @DisplayName("Client id must fit an unsigned 16-bit value")
    void testOpenOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> ClientAccount.open(-1));
        assertThrows(IllegalArgumentException.class, () -> ClientAccount.open(65_536));
        assertEquals(65_535, ClientAccount.open(65_535).getClientId());
    }

    @Test
    @DisplayName("Every operation keeps total equal to available plus held")
    void testOperationsStayBalanced() {
        ClientAccount account = ClientAccount.open(1);
        BigDecimal amount = new BigDecimal("12.3456");

        account.credit(amount);
        assertTrue(account.isBalanced());
        account.hold(amount);
        assertTrue(account.isBalanced());
        account.release(amount);
        assertTrue(account.isBalanced());
        account.hold(amount);
        account.chargeBack(amount);
        assertTrue(account.isBalanced());
        account.debit(new BigDecimal("1"));
        assertTrue(account.isBalanced());

        assertEquals(0, new BigDecimal("-1").compareTo(account.getTotal()));
        assertTrue(account.isLocked());
    }

    @Test
    @DisplayName("hasAvailable compares by value, not scale")
    void testHasAvailable() {
        ClientAccount account = ClientAccount.open(1);
        account.credit(new BigDecimal("2.00"));

        assertTrue(account.hasAvailable(new BigDecimal("2")));
        assertFalse(account.hasAvailable(new BigDecimal("2.0001")));
    }
}
