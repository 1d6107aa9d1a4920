package com.flagship.transaction_ledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from the {@code ledger.*} keys of application.yml.
 *
 * {@code ledger.cli.enabled} is not bound here; it is read directly by the
 * condition on the command line runner.
 */
@Data
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private Settlement settlement = new Settlement();
    private Output output = new Output();

    @Data
    public static class Settlement {
        /**
         * When true, nothing settles against an account after its chargeback.
         * Off by default: locked accounts keep accepting transactions.
         */
        private boolean rejectLockedAccounts = false;
    }

    @Data
    public static class Output {
        /**
         * Fractional digits printed for every amount.
         */
        private int scale = 4;
    }
}
