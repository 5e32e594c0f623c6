package com.spinbet.ledgersync.modules.chains.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Event page request. A set cursor takes precedence; the start ledger is only sent without one.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EventQuery {

    private String contractId;

    private String cursor;

    private long startLedger;

    private int limit;

    public static EventQuery fromCursor(String contractId, String cursor, int limit) {
        return new EventQuery(contractId, cursor, 0L, limit);
    }

    public static EventQuery fromLedger(String contractId, long startLedger, int limit) {
        return new EventQuery(contractId, null, Math.max(1L, startLedger), limit);
    }

    public boolean hasCursor() {
        return cursor != null && !cursor.isBlank();
    }
}
