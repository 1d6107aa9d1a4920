package com.flagship.transaction_ledger.csv;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.transaction_ledger.config.LedgerProperties;
import com.flagship.transaction_ledger.exception.AccountOutputException;
import com.flagship.transaction_ledger.ledger.ClientAccount;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.util.Collection;
import java.util.List;

/**
 * Writes the final account snapshot as CSV.
 *
 * Header: client, available, held, total, locked
 * Rows follow the iteration order of the given collection. An empty snapshot
 * produces no output at all, header included.
 */
@Component
@RequiredArgsConstructor
public class AccountCsvWriter {

    private final CsvMapper csvMapper;
    private final LedgerProperties properties;

    /**
     * Writes header and rows, then flushes. The writer is left open.
     *
     * @throws AccountOutputException if writing fails
     */
    public void write(Collection<ClientAccount> accounts, Writer out) {
        if (accounts.isEmpty()) {
            return;
        }
        int scale = properties.getOutput().getScale();
        List<AccountCsvRow> rows = accounts.stream()
            .map(account -> AccountCsvRow.fromAccount(account, scale))
            .toList();
        CsvSchema schema = csvMapper.schemaFor(AccountCsvRow.class).withHeader();

        try {
            csvMapper.writer(schema)
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValue(out, rows);
            out.flush();
        } catch (IOException e) {
            throw new AccountOutputException("Failed to write account snapshot: " + e.getMessage(), e);
        }
    }
}
