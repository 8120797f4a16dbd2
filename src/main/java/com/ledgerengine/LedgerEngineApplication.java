package com.ledgerengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Ledger Engine.
 *
 * Ledger Engine reads an ordered file of client transactions (deposits,
 * withdrawals, disputes, resolves and chargebacks), applies them to per-client
 * accounts in a single pass, and writes the final account states together with
 * every record that could not be applied.
 */
@SpringBootApplication
public class LedgerEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(LedgerEngineApplication.class, args);
    }
}
