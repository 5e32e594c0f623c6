package com.spinbet.ledgersync.modules.chains.events;

import lombok.Getter;
import lombok.ToString;

/**
 * Paging position carried from one poll cycle to the next. Immutable; each cycle produces a new one.
 */
@Getter
@ToString
public final class PollerState {

    private final String cursor;
    private final long lastLedger;

    public PollerState(String cursor, long lastLedger) {
        this.cursor = cursor;
        this.lastLedger = lastLedger;
    }

    public boolean hasCursor() {
        return cursor != null && !cursor.isBlank();
    }

    /**
     * State after a fully applied page. A blank next cursor keeps the current one; the ledger
     * watermark never moves backwards.
     */
    public PollerState advance(String nextCursor, long maxLedgerSeen) {
        String cursorAfter = nextCursor != null && !nextCursor.isBlank() ? nextCursor : cursor;
        return new PollerState(cursorAfter, Math.max(lastLedger, maxLedgerSeen));
    }

    /**
     * Height-based paging from {@code ledger}, cursor dropped.
     */
    public PollerState resetTo(long ledger) {
        return new PollerState(null, ledger);
    }
}
