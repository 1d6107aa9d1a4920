package com.flagship.transaction_ledger.settlement;

import com.flagship.transaction_ledger.ledger.ClientAccount;
import com.flagship.transaction_ledger.observability.RunContext;
import com.flagship.transaction_ledger.observability.SettlementMetrics;
import com.flagship.transaction_ledger.transaction.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replays an ordered transaction log into final client accounts.
 *
 * The loop works on a FIFO queue seeded with the log:
 * 1. Deposits and withdrawals settle immediately and enter the reference index
 * 2. Dispute family records settle when their tx id is in the index
 * 3. Otherwise they go to the back of the queue and are retried later
 *
 * A record referencing a tx id that never shows up would cycle forever, so the
 * loop stops once every queued record has been deferred since the index last
 * changed. Those records are returned as unresolved. Forward references that
 * do resolve later in the log are never cut off by this rule.
 *
 * Queue, index and accounts live only for the duration of one call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionProcessor {

    private final SettlementEngine settlementEngine;
    private final SettlementMetrics metrics;

    /**
     * Processes the transactions in order.
     *
     * @param transactions The log, in arrival order
     * @return Final accounts plus any records that could not be resolved
     */
    public ProcessingResult process(List<Transaction> transactions) {
        long startTime = System.currentTimeMillis();

        Deque<Transaction> queue = new ArrayDeque<>(transactions.size());
        queue.addAll(transactions);
        Map<Integer, ClientAccount> accounts = new LinkedHashMap<>();
        Map<Long, Transaction> referenceIndex = new HashMap<>();
        List<Transaction> unresolved = new ArrayList<>();

        long settled = 0;
        long deferrals = 0;
        // Deferrals since the reference index last changed
        int idleDeferrals = 0;

        while (!queue.isEmpty()) {
            if (idleDeferrals >= queue.size()) {
                log.debug("No progress possible for {} queued records", queue.size());
                unresolved.addAll(queue);
                queue.clear();
                break;
            }

            Transaction transaction = queue.pollFirst();
            ClientAccount account = accounts.computeIfAbsent(transaction.getClientId(), ClientAccount::open);

            RunContext.enterTransaction(transaction.getClientId(), transaction.getTxId());
            try {
                if (transaction.getType().isReferenceable()) {
                    settlementEngine.settle(account, transaction, null);
                    Transaction replaced = referenceIndex.put(transaction.getTxId(), transaction);
                    if (replaced != null) {
                        metrics.incrementReplacedReference();
                        log.warn("Transaction id {} reused; {} replaces earlier {}",
                                transaction.getTxId(), transaction.getType().code(), replaced.getType().code());
                    }
                    settled++;
                    idleDeferrals = 0;
                    continue;
                }

                Transaction referenced = referenceIndex.get(transaction.getTxId());
                if (referenced != null) {
                    settlementEngine.settle(account, transaction, referenced);
                    settled++;
                    continue;
                }

                queue.addLast(transaction);
                metrics.incrementDeferred();
                deferrals++;
                idleDeferrals++;
            } finally {
                RunContext.leaveTransaction();
            }
        }

        if (!unresolved.isEmpty()) {
            metrics.incrementUnresolved(unresolved.size());
            log.warn("{} transactions reference unknown tx ids and were not settled:", unresolved.size());
            for (Transaction transaction : unresolved) {
                log.warn("  unresolved {} client={} tx={}",
                        transaction.getType().code(), transaction.getClientId(), transaction.getTxId());
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        metrics.recordProcessingDuration(Duration.ofMillis(duration));
        log.debug("Processed {} transactions in {}ms", transactions.size(), duration);

        return new ProcessingResult(
                Collections.unmodifiableMap(accounts),
                Collections.unmodifiableList(unresolved),
                settled,
                deferrals);
    }
}
