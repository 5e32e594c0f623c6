package com.spinbet.ledgersync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "stellar")
public class StellarRpcProperties {

    /**
     * Soroban RPC endpoint.
     */
    private String rpcUrl = "https://soroban-testnet.stellar.org";

    /**
     * Contract whose events are ingested.
     */
    private String contractId;

    private long connectTimeoutMs = 5_000;

    private long readTimeoutMs = 15_000;

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public String getContractId() {
        return contractId;
    }

    public void setContractId(String contractId) {
        this.contractId = contractId;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public long getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(long readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }

    public boolean isConfigured() {
        return rpcUrl != null && !rpcUrl.isBlank() && contractId != null && !contractId.isBlank();
    }
}
