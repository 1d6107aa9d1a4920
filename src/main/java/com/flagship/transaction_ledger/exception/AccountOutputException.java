package com.flagship.transaction_ledger.exception;

/**
 * Writing the account snapshot failed. Output may be incomplete.
 */
public class AccountOutputException extends LedgerException {

    public static final int EXIT_CODE = 4;

    public AccountOutputException(String message) {
        super(message);
    }

    public AccountOutputException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
