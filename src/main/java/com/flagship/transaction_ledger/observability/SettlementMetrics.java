package com.flagship.transaction_ledger.observability;

import com.flagship.transaction_ledger.settlement.SettlementOutcome;
import com.flagship.transaction_ledger.transaction.TransactionType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for settlement and the processing loop.
 *
 * Metrics exposed:
 * - ledger.settlement: counter tagged by transaction type and outcome
 * - ledger.processing.deferred: records pushed back for a missing reference
 * - ledger.processing.unresolved: records given up at the end of a run
 * - ledger.settlement.client_mismatch: dispute family pointing at another client's record
 * - ledger.reference.replaced: deposit or withdrawal reusing an indexed tx id
 * - ledger.processing.duration: time spent in one processing loop
 *
 * Non-applied outcomes never surface as errors; these counters are where they show up.
 * The end-of-run summary is built from {@link #snapshot()} deltas.
 */
@Component
public class SettlementMetrics {

    private final MeterRegistry registry;

    private final Counter deferred;
    private final Counter unresolved;
    private final Counter clientMismatches;
    private final Counter replacedReferences;
    private final Timer processingTimer;

    public SettlementMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.deferred = Counter.builder("ledger.processing.deferred")
                .description("Records pushed to the back of the queue for a missing reference")
                .register(registry);

        this.unresolved = Counter.builder("ledger.processing.unresolved")
                .description("Records whose reference never appeared")
                .register(registry);

        this.clientMismatches = Counter.builder("ledger.settlement.client_mismatch")
                .description("Dispute family records referencing another client's transaction")
                .register(registry);

        this.replacedReferences = Counter.builder("ledger.reference.replaced")
                .description("Deposits or withdrawals that replaced an indexed transaction id")
                .register(registry);

        this.processingTimer = Timer.builder("ledger.processing.duration")
                .description("Time taken to replay one transaction log")
                .register(registry);
    }

    /**
     * Records one settlement attempt.
     * Uses registry.counter() for efficient meter lookup/creation.
     */
    public void recordSettlement(TransactionType type, SettlementOutcome outcome) {
        registry.counter("ledger.settlement",
                "type", type.code(),
                "outcome", outcome.tagValue()
        ).increment();
    }

    public double settlementCount(TransactionType type, SettlementOutcome outcome) {
        Counter counter = registry.find("ledger.settlement")
                .tag("type", type.code())
                .tag("outcome", outcome.tagValue())
                .counter();
        return counter != null ? counter.count() : 0;
    }

    public void incrementDeferred() {
        deferred.increment();
    }

    public void incrementUnresolved(int count) {
        unresolved.increment(count);
    }

    public void incrementClientMismatch() {
        clientMismatches.increment();
    }

    public void incrementReplacedReference() {
        replacedReferences.increment();
    }

    public double deferredCount() {
        return deferred.count();
    }

    public double unresolvedCount() {
        return unresolved.count();
    }

    public double clientMismatchCount() {
        return clientMismatches.count();
    }

    /**
     * Sum of every settlement attempt that left the account untouched.
     */
    public double rejectedCount() {
        double total = 0;
        for (TransactionType type : TransactionType.values()) {
            for (SettlementOutcome outcome : SettlementOutcome.values()) {
                if (!outcome.isApplied()) {
                    total += settlementCount(type, outcome);
                }
            }
        }
        return total;
    }

    public void recordProcessingDuration(Duration duration) {
        processingTimer.record(duration);
    }

    /**
     * Current counter values. The registry outlives a single run, so callers
     * diff two snapshots with {@link Snapshot#since(Snapshot)}.
     */
    public Snapshot snapshot() {
        return new Snapshot(
                (long) deferredCount(),
                (long) unresolvedCount(),
                (long) clientMismatchCount(),
                (long) rejectedCount());
    }

    @Value
    public static class Snapshot {
        long deferred;
        long unresolved;
        long clientMismatches;
        long rejected;

        public Snapshot since(Snapshot earlier) {
            return new Snapshot(
                    deferred - earlier.deferred,
                    unresolved - earlier.unresolved,
                    clientMismatches - earlier.clientMismatches,
                    rejected - earlier.rejected);
        }
    }
}
