package com.spinbet.ledgersync.modules.chains.rpc;

import java.util.List;
import java.util.Locale;

/**
 * The requested cursor or start ledger is older than the RPC node retains.
 */
public class RetentionWindowException extends RpcException {

    private static final List<String> MARKERS = List.of(
            "retention",
            "outside of range",
            "before oldest ledger",
            "startledger",
            "must be between"
    );

    public RetentionWindowException(String message) {
        super(message);
    }

    public RetentionWindowException(String message, Throwable cause) {
        super(message, cause);
    }

    public static boolean matches(String message) {
        if (message == null) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        return MARKERS.stream().anyMatch(normalized::contains);
    }
}
