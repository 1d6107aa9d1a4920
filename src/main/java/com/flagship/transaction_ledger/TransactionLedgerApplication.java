package com.flagship.transaction_ledger;

import com.flagship.transaction_ledger.config.LedgerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Replays a CSV transaction log and prints the resulting client accounts.
 *
 * Usage: java -jar transaction-ledger.jar transactions.csv > accounts.csv
 */
@SpringBootApplication
@EnableConfigurationProperties(LedgerProperties.class)
public class TransactionLedgerApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TransactionLedgerApplication.class, args)));
    }
}
