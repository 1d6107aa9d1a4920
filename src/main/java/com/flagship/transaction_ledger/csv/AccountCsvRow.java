package com.flagship.transaction_ledger.csv;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flagship.transaction_ledger.ledger.ClientAccount;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * One output row of the account snapshot.
 * Amounts are pre-formatted so the CSV never shows scientific notation.
 */
@Value
@JsonPropertyOrder({"client", "available", "held", "total", "locked"})
public class AccountCsvRow {
    int client;
    String available;
    String held;
    String total;
    boolean locked;

    public static AccountCsvRow fromAccount(ClientAccount account, int scale) {
        return new AccountCsvRow(
            account.getClientId(),
            format(account.getAvailable(), scale),
            format(account.getHeld(), scale),
            format(account.getTotal(), scale),
            account.isLocked()
        );
    }

    private static String format(BigDecimal amount, int scale) {
        return amount.setScale(scale, RoundingMode.HALF_EVEN).toPlainString();
    }
}
