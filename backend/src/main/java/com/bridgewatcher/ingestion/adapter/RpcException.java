package com.bridgewatcher.ingestion.adapter;

/**
 * Thrown when a ledger RPC call fails (HTTP, transport or JSON-RPC error).
 * Callers branch on the subtype: {@link LedgerUnavailableException} is retried on the next poll,
 * {@link LedgerFatalException} stops the watcher.
 */
public abstract class RpcException extends RuntimeException {

    protected RpcException(String message) {
        super(message);
    }

    protected RpcException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();
}
