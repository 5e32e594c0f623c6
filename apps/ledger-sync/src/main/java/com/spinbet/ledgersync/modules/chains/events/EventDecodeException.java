package com.spinbet.ledgersync.modules.chains.events;

/**
 * A chain-native value could not be decoded into the payload model.
 */
public class EventDecodeException extends RuntimeException {

    public EventDecodeException(String message) {
        super(message);
    }

    public EventDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
