package com.spinbet.ledgersync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * SpinBet ledger sync application.
 * Ingests Soroban contract events into the off-chain ledger.
 */
@SpringBootApplication
public class LedgerSyncApplication {

    private static final Logger logger = LoggerFactory.getLogger(LedgerSyncApplication.class);

    public static void main(String[] args) {
        logger.info("Starting SpinBet ledger sync...");
        SpringApplication.run(LedgerSyncApplication.class, args);
        logger.info("SpinBet ledger sync started");
    }
}
