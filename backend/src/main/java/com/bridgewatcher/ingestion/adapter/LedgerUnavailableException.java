package com.bridgewatcher.ingestion.adapter;

/**
 * Transient ledger failure: timeout, connection error, HTTP 429/5xx, node-side transient JSON-RPC error.
 */
public class LedgerUnavailableException extends RpcException {

    public LedgerUnavailableException(String message) {
        super(message);
    }

    public LedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
