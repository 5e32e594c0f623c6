package com.spinbet.ledgersync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Contract event listener configuration.
 *
 * <p>Bound from {@code contract-events.*}. Poll-level reconnect backoff and per-event retry are
 * configured separately.
 */
@Component
@ConfigurationProperties(prefix = "contract-events")
public class ContractEventsProperties {

    /**
     * Enable the poll loop.
     */
    private boolean enabled = true;

    /**
     * Delay after a successful poll cycle, in milliseconds.
     */
    private long pollIntervalMs = 5_000;

    /**
     * Events requested per page.
     */
    private int pageLimit = 100;

    /**
     * Apply attempts per event before it is marked failed.
     */
    private int processingRetryAttempts = 3;

    private long processingRetryBaseDelayMs = 300;

    private long processingRetryMaxDelayMs = 2_000;

    /**
     * Reconnect backoff base after a failed cycle, in milliseconds.
     */
    private long reconnectBaseDelayMs = 1_000;

    /**
     * Reconnect backoff cap, in milliseconds.
     */
    private long reconnectMaxDelayMs = 30_000;

    /**
     * First ledger to read when no checkpoint exists. Zero means "near the latest ledger".
     */
    private long startLedger = 0L;

    /**
     * Timeout of each per-event database transaction, in seconds.
     */
    private int transactionTimeoutSeconds = 30;

    /**
     * Fixed key of the checkpoint row.
     */
    private String checkpointId = "soroban_contract_listener";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public int getPageLimit() {
        return pageLimit;
    }

    public void setPageLimit(int pageLimit) {
        this.pageLimit = pageLimit;
    }

    public int getProcessingRetryAttempts() {
        return processingRetryAttempts;
    }

    public void setProcessingRetryAttempts(int processingRetryAttempts) {
        this.processingRetryAttempts = processingRetryAttempts;
    }

    public long getProcessingRetryBaseDelayMs() {
        return processingRetryBaseDelayMs;
    }

    public void setProcessingRetryBaseDelayMs(long processingRetryBaseDelayMs) {
        this.processingRetryBaseDelayMs = processingRetryBaseDelayMs;
    }

    public long getProcessingRetryMaxDelayMs() {
        return processingRetryMaxDelayMs;
    }

    public void setProcessingRetryMaxDelayMs(long processingRetryMaxDelayMs) {
        this.processingRetryMaxDelayMs = processingRetryMaxDelayMs;
    }

    public long getReconnectBaseDelayMs() {
        return reconnectBaseDelayMs;
    }

    public void setReconnectBaseDelayMs(long reconnectBaseDelayMs) {
        this.reconnectBaseDelayMs = reconnectBaseDelayMs;
    }

    public long getReconnectMaxDelayMs() {
        return reconnectMaxDelayMs;
    }

    public void setReconnectMaxDelayMs(long reconnectMaxDelayMs) {
        this.reconnectMaxDelayMs = reconnectMaxDelayMs;
    }

    public long getStartLedger() {
        return startLedger;
    }

    public void setStartLedger(long startLedger) {
        this.startLedger = startLedger;
    }

    public int getTransactionTimeoutSeconds() {
        return transactionTimeoutSeconds;
    }

    public void setTransactionTimeoutSeconds(int transactionTimeoutSeconds) {
        this.transactionTimeoutSeconds = transactionTimeoutSeconds;
    }

    public String getCheckpointId() {
        return checkpointId;
    }

    public void setCheckpointId(String checkpointId) {
        this.checkpointId = checkpointId;
    }
}
