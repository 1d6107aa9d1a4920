package com.flagship.transaction_ledger.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class RunContextTest {

    @AfterEach
    void tearDown() {
        RunContext.clear();
    }

    @Test
    @DisplayName("Client and tx ids are set per record and removed afterwards")
    void testTransactionKeys() {
        String runId = RunContext.start();

        RunContext.enterTransaction(7, 42L);
        assertEquals("7", MDC.get(RunContext.CLIENT_ID_MDC_KEY));
        assertEquals("42", MDC.get(RunContext.TX_ID_MDC_KEY));

        RunContext.leaveTransaction();
        assertNull(MDC.get(RunContext.CLIENT_ID_MDC_KEY));
        assertNull(MDC.get(RunContext.TX_ID_MDC_KEY));
        assertEquals(runId, MDC.get(RunContext.RUN_ID_MDC_KEY));
    }

    @Test
    @DisplayName("Clear removes the run id")
    void testClear() {
        RunContext.start();
        RunContext.enterTransaction(1, 1L);

        RunContext.clear();

        assertNull(MDC.get(RunContext.RUN_ID_MDC_KEY));
        assertNull(MDC.get(RunContext.CLIENT_ID_MDC_KEY));
    }
}
