package com.flagship.transaction_ledger.csv;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.transaction_ledger.exception.TransactionInputException;
import com.flagship.transaction_ledger.transaction.Transaction;
import com.flagship.transaction_ledger.transaction.TransactionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the transaction log from CSV.
 *
 * Expected format:
 * <pre>
 *   type, client, tx, amount
 *   deposit, 1, 1, 1.0
 *   dispute, 1, 1,
 * </pre>
 * Types are matched ignoring case. A blank or unparseable amount is read as
 * absent. Anything else malformed aborts the read with {@link TransactionInputException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransactionCsvReader {

    private static final CsvSchema SCHEMA = CsvSchema.emptySchema().withHeader();

    private final CsvMapper csvMapper;

    /**
     * Reads every record of the file, in file order.
     *
     * @throws TransactionInputException if the file cannot be read or a record is malformed
     */
    public List<Transaction> read(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        } catch (IOException e) {
            throw new TransactionInputException("Cannot read transactions file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads every record from an open reader and closes it.
     *
     * @param source Name used in error messages
     */
    public List<Transaction> read(Reader reader, String source) {
        List<Transaction> transactions = new ArrayList<>();
        try (MappingIterator<TransactionCsvRow> rows = csvMapper
                .readerFor(TransactionCsvRow.class)
                .with(SCHEMA)
                .readValues(reader)) {
            while (rows.hasNextValue()) {
                TransactionCsvRow row = rows.nextValue();
                int line = rows.getCurrentLocation().getLineNr();
                transactions.add(toTransaction(row, source, line));
            }
        } catch (IOException | RuntimeJsonMappingException e) {
            throw new TransactionInputException(
                String.format("Malformed CSV in %s: %s", source, e.getMessage()), e);
        }

        log.debug("Read {} transactions from {}", transactions.size(), source);
        return transactions;
    }

    private Transaction toTransaction(TransactionCsvRow row, String source, int line) {
        try {
            TransactionType type = TransactionType.fromCode(row.getType());
            int clientId = parseClientId(row.getClient());
            long txId = parseTxId(row.getTx());
            return Transaction.of(type, clientId, txId, parseAmount(row.getAmount()));
        } catch (IllegalArgumentException e) {
            throw new TransactionInputException(
                String.format("Invalid record at %s line %d: %s", source, line, e.getMessage()), e);
        }
    }

    private int parseClientId(String value) {
        long clientId = parseUnsigned("client", value);
        if (clientId > Transaction.MAX_CLIENT_ID) {
            throw new IllegalArgumentException("client out of range: " + value);
        }
        return (int) clientId;
    }

    private long parseTxId(String value) {
        long txId = parseUnsigned("tx", value);
        if (txId > Transaction.MAX_TX_ID) {
            throw new IllegalArgumentException("tx out of range: " + value);
        }
        return txId;
    }

    private long parseUnsigned(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        long parsed;
        try {
            parsed = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(field + " is not an integer: " + value, e);
        }
        if (parsed < 0) {
            throw new IllegalArgumentException(field + " must not be negative: " + value);
        }
        return parsed;
    }

    /**
     * Blank or unparseable amounts become absent rather than failing the read.
     */
    private BigDecimal parseAmount(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring unparseable amount '{}'", value);
            return null;
        }
    }
}
