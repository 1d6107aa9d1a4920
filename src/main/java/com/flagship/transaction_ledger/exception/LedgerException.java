package com.flagship.transaction_ledger.exception;

import org.springframework.boot.ExitCodeGenerator;

/**
 * Base class for failures that abort a ledger run.
 *
 * Each subclass maps to its own process exit code; Spring Boot picks the code
 * up from the exception when it escapes the command line runner.
 */
public abstract class LedgerException extends RuntimeException implements ExitCodeGenerator {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
