package com.spinbet.ledgersync.modules.chains.rpc;

/**
 * Thrown when a ledger RPC call fails (transport, HTTP or JSON-RPC error).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
