package com.spinbet.ledgersync.modules.chains.events;

import lombok.Getter;

/**
 * An event could not be applied within its retry budget. Aborts the rest of the page.
 */
@Getter
public class EventProcessingException extends RuntimeException {

    private final String eventId;

    public EventProcessingException(String eventId, Throwable cause) {
        super("Failed to apply contract event " + eventId + ": " + (cause != null ? cause.getMessage() : "unknown error"),
                cause);
        this.eventId = eventId;
    }
}
