package com.spinbet.ledgersync.modules.chains.events;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ReconnectBackoffTest {

    @Test
    void doublesFromBaseAndResetsAfterSuccess() {
        ReconnectBackoff backoff = new ReconnectBackoff(1_000, 30_000);

        assertEquals(1_000, backoff.nextDelay());
        assertEquals(2_000, backoff.nextDelay());
        assertEquals(4_000, backoff.nextDelay());
        assertEquals(3, backoff.getAttempts());

        backoff.reset();

        assertEquals(0, backoff.getAttempts());
        assertEquals(1_000, backoff.nextDelay());
    }

    @Test
    void isCapped() {
        ReconnectBackoff backoff = new ReconnectBackoff(1_000, 3_000);

        backoff.nextDelay();
        backoff.nextDelay();

        assertEquals(3_000, backoff.nextDelay());
        assertEquals(3_000, backoff.nextDelay());
    }
}
