package com.spinbet.ledgersync.modules.chains.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time view of the contract event poller for health and monitoring.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ListenerSnapshot {

    private boolean enabled;

    private String contractId;

    private String cursor;

    private long lastLedger;

    private int reconnectAttempts;

    private boolean polling;
}
