package com.flagship.transaction_ledger.csv;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw row of the input log, before validation.
 *
 * Columns (matched by header name): type, client, tx, amount
 * All fields stay strings so a bad amount can be turned into "absent"
 * instead of failing the whole file.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TransactionCsvRow {
    private String type;
    private String client;
    private String tx;
    private String amount;
}
