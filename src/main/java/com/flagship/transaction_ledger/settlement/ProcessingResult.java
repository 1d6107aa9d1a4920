package com.flagship.transaction_ledger.settlement;

import com.flagship.transaction_ledger.ledger.ClientAccount;
import com.flagship.transaction_ledger.transaction.Transaction;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of replaying a transaction log.
 *
 * accounts holds every client seen in the log, keyed by client id.
 * unresolved lists the dispute family records whose reference never appeared,
 * in the order they were given up.
 */
@Value
public class ProcessingResult {
    Map<Integer, ClientAccount> accounts;
    List<Transaction> unresolved;
    long settledCount;
    long deferralCount;

    public Optional<ClientAccount> getAccount(int clientId) {
        return Optional.ofNullable(accounts.get(clientId));
    }

    public boolean hasUnresolved() {
        return !unresolved.isEmpty();
    }
}
