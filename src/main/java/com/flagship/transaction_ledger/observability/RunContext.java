package com.flagship.transaction_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys for one ledger run.
 *
 * The run id tags every log line of a run; the tx id is set while a single
 * record is being settled.
 */
public final class RunContext {

    public static final String RUN_ID_MDC_KEY = "runId";
    public static final String TX_ID_MDC_KEY = "txId";
    public static final String CLIENT_ID_MDC_KEY = "clientId";

    private RunContext() {
        // Utility class
    }

    /**
     * Starts a run and returns its id.
     */
    public static String start() {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(RUN_ID_MDC_KEY, runId);
        return runId;
    }

    public static void enterTransaction(int clientId, long txId) {
        MDC.put(CLIENT_ID_MDC_KEY, String.valueOf(clientId));
        MDC.put(TX_ID_MDC_KEY, String.valueOf(txId));
    }

    public static void leaveTransaction() {
        MDC.remove(CLIENT_ID_MDC_KEY);
        MDC.remove(TX_ID_MDC_KEY);
    }

    /**
     * Clears every key set by this class.
     */
    public static void clear() {
        leaveTransaction();
        MDC.remove(RUN_ID_MDC_KEY);
    }
}
