package com.flagship.transaction_ledger.exception;

/**
 * The run was started without what it needs, e.g. no input path.
 * Raised before any record is read.
 */
public class LedgerConfigurationException extends LedgerException {

    public static final int EXIT_CODE = 2;

    public LedgerConfigurationException(String message) {
        super(message);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
