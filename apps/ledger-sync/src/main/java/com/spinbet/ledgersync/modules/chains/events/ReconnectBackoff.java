package com.spinbet.ledgersync.modules.chains.events;

import com.spinbet.ledgersync.util.RetryUtils;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Poll-level reconnect backoff: {@code min(base * 2^(n-1), cap)} for the n-th consecutive failure,
 * back to {@code base} after a success.
 */
public class ReconnectBackoff {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final AtomicInteger attempts = new AtomicInteger();

    public ReconnectBackoff(long baseDelayMs, long maxDelayMs) {
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    /**
     * Count a failure and return the delay before the next cycle.
     */
    public long nextDelay() {
        return RetryUtils.backoffDelay(attempts.incrementAndGet(), baseDelayMs, maxDelayMs);
    }

    public void reset() {
        attempts.set(0);
    }

    public int getAttempts() {
        return attempts.get();
    }
}
