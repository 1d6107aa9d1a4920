package com.flagship.transaction_ledger.csv;

import com.flagship.transaction_ledger.config.CsvConfig;
import com.flagship.transaction_ledger.exception.TransactionInputException;
import com.flagship.transaction_ledger.transaction.Transaction;
import com.flagship.transaction_ledger.transaction.TransactionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Input parsing tests.
 *
 * These tests verify that:
 * - Whitespace and case variations are accepted
 * - Blank or garbage amounts become absent instead of failing
 * - Malformed ids and types abort the read
 */
class TransactionCsvReaderTest {

    @TempDir
    Path tempDir;

    private TransactionCsvReader reader;

    @BeforeEach
    void setUp() {
        reader = new TransactionCsvReader(new CsvConfig().csvMapper());
    }

    private List<Transaction> read(String csv) {
        return reader.read(new StringReader(csv), "test.csv");
    }

    @Test
    @DisplayName("Reads a padded file in order")
    void testReadPaddedFile() throws IOException {
        Path file = tempDir.resolve("transactions.csv");
        Files.writeString(file, String.join("\n",
            "type, client, tx, amount",
            "deposit, 1, 1, 1.0",
            "deposit,   2,  2,  2.0",
            "withdrawal, 1, 4, 1.5",
            "dispute, 1, 1,",
            ""));

        List<Transaction> transactions = reader.read(file);

        assertEquals(4, transactions.size());
        assertEquals(Transaction.deposit(1, 1, new BigDecimal("1.0")), transactions.get(0));
        assertEquals(Transaction.deposit(2, 2, new BigDecimal("2.0")), transactions.get(1));
        assertEquals(Transaction.withdrawal(1, 4, new BigDecimal("1.5")), transactions.get(2));
        assertEquals(Transaction.dispute(1, 1), transactions.get(3));
    }

    @Test
    @DisplayName("Type is case-insensitive")
    void testTypeCase() {
        List<Transaction> transactions = read("type,client,tx,amount\nDEPOSIT,1,1,5\nChargeBack,1,1,\n");

        assertEquals(TransactionType.DEPOSIT, transactions.get(0).getType());
        assertEquals(TransactionType.CHARGEBACK, transactions.get(1).getType());
    }

    @Test
    @DisplayName("Blank, missing or unparseable amounts are absent")
    void testAbsentAmounts() {
        List<Transaction> transactions = read(String.join("\n",
            "type,client,tx,amount",
            "deposit,1,1,",
            "deposit,1,2,  ",
            "deposit,1,3,abc",
            "resolve,1,3",
            ""));

        assertEquals(4, transactions.size());
        transactions.forEach(tx -> assertTrue(tx.getAmount().isEmpty(), () -> "amount should be absent: " + tx));
    }

    @Test
    @DisplayName("Four fractional digits are kept exactly")
    void testPrecision() {
        List<Transaction> transactions = read("type,client,tx,amount\ndeposit,1,1,500.0005\n");

        assertEquals(new BigDecimal("500.0005"), transactions.get(0).getAmount().orElseThrow());
    }

    @Test
    @DisplayName("Header only yields no transactions")
    void testHeaderOnly() {
        assertTrue(read("type,client,tx,amount\n").isEmpty());
    }

    @Test
    @DisplayName("Unknown type aborts the read")
    void testUnknownType() {
        TransactionInputException e = assertThrows(TransactionInputException.class,
            () -> read("type,client,tx,amount\ndeposit,1,1,1\nrefund,1,2,1\n"));

        assertTrue(e.getMessage().contains("refund"), e.getMessage());
        assertEquals(TransactionInputException.EXIT_CODE, e.getExitCode());
    }

    @Test
    @DisplayName("Non-numeric or out of range ids abort the read")
    void testInvalidIds() {
        assertThrows(TransactionInputException.class, () -> read("type,client,tx,amount\ndeposit,one,1,1\n"));
        assertThrows(TransactionInputException.class, () -> read("type,client,tx,amount\ndeposit,65536,1,1\n"));
        assertThrows(TransactionInputException.class, () -> read("type,client,tx,amount\ndeposit,-1,1,1\n"));
        assertThrows(TransactionInputException.class, () -> read("type,client,tx,amount\ndeposit,1,4294967296,1\n"));
        assertThrows(TransactionInputException.class, () -> read("type,client,tx,amount\ndeposit,1,,1\n"));
    }

    @Test
    @DisplayName("Largest ids are accepted")
    void testMaxIds() {
        Transaction transaction = read("type,client,tx,amount\ndeposit,65535,4294967295,1\n").get(0);

        assertEquals(65_535, transaction.getClientId());
        assertEquals(4_294_967_295L, transaction.getTxId());
    }

    @Test
    @DisplayName("Missing file aborts the read")
    void testMissingFile() {
        Path missing = tempDir.resolve("missing.csv");

        TransactionInputException e = assertThrows(TransactionInputException.class, () -> reader.read(missing));
        assertTrue(e.getMessage().contains("missing.csv"), e.getMessage());
    }
}
