package com.flagship.transaction_ledger.exception;

/**
 * The transaction log could not be read or holds a malformed record.
 * Aborts the whole run; nothing is written.
 */
public class TransactionInputException extends LedgerException {

    public static final int EXIT_CODE = 3;

    public TransactionInputException(String message) {
        super(message);
    }

    public TransactionInputException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
