package com.spinbet.ledgersync.modules.chains.model;

public enum ContractEventStatus {
    PENDING,
    PROCESSED,
    SKIPPED,
    FAILED;

    /**
     * Processed and skipped events are never applied again.
     */
    public boolean isTerminal() {
        return this == PROCESSED || this == SKIPPED;
    }
}
