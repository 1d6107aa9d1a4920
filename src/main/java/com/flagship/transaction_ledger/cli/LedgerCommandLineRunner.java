package com.flagship.transaction_ledger.cli;

import com.flagship.transaction_ledger.csv.AccountCsvWriter;
import com.flagship.transaction_ledger.csv.TransactionCsvReader;
import com.flagship.transaction_ledger.exception.AccountOutputException;
import com.flagship.transaction_ledger.exception.LedgerConfigurationException;
import com.flagship.transaction_ledger.observability.RunContext;
import com.flagship.transaction_ledger.observability.SettlementMetrics;
import com.flagship.transaction_ledger.settlement.ProcessingResult;
import com.flagship.transaction_ledger.settlement.TransactionProcessor;
import com.flagship.transaction_ledger.transaction.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Command line entry point: reads the log named by the first argument,
 * replays it and writes the account snapshot to stdout.
 *
 * Failures escape as {@link com.flagship.transaction_ledger.exception.LedgerException}
 * subclasses, which carry the process exit code:
 * - no input path: configuration error, nothing is read
 * - unreadable or malformed input: nothing is written
 * - write failure: output may be incomplete
 */
@Component
@ConditionalOnProperty(name = "ledger.cli.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LedgerCommandLineRunner implements ApplicationRunner {

    private final TransactionCsvReader reader;
    private final TransactionProcessor processor;
    private final AccountCsvWriter writer;
    private final SettlementMetrics metrics;

    @Override
    public void run(ApplicationArguments args) {
        execute(args.getNonOptionArgs(), System.out);
    }

    /**
     * Runs one replay.
     *
     * @param args Positional arguments; the first is the input path
     * @param out Destination of the CSV snapshot
     * @return The processing result that was written
     */
    public ProcessingResult execute(List<String> args, OutputStream out) {
        if (args.isEmpty()) {
            throw new LedgerConfigurationException(
                "No transactions file provided, please specify a transaction file.");
        }
        Path input = Path.of(args.get(0));

        String runId = RunContext.start();
        try {
            log.debug("Starting run {} for {}", runId, input);

            List<Transaction> transactions = reader.read(input);
            SettlementMetrics.Snapshot before = metrics.snapshot();
            ProcessingResult result = processor.process(transactions);

            Writer output = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            writer.write(result.getAccounts().values(), output);
            if (out instanceof PrintStream printStream && printStream.checkError()) {
                throw new AccountOutputException("Failed to write account snapshot to standard output");
            }

            SettlementMetrics.Snapshot run = metrics.snapshot().since(before);
            log.info("Run complete: read={}, settled={}, rejected={}, deferred={}, unresolved={}, "
                            + "clientMismatches={}, accounts={}",
                    transactions.size(), result.getSettledCount(), run.getRejected(), run.getDeferred(),
                    run.getUnresolved(), run.getClientMismatches(), result.getAccounts().size());
            return result;
        } finally {
            RunContext.clear();
        }
    }
}
