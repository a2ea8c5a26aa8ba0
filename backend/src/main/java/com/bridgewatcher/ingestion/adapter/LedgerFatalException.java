package com.bridgewatcher.ingestion.adapter;

/**
 * Non-recoverable ledger failure: authentication rejected, malformed endpoint, invalid request or selector,
 * or the ledger staying unreachable past the configured number of polls.
 */
public class LedgerFatalException extends RpcException {

    public LedgerFatalException(String message) {
        super(message);
    }

    public LedgerFatalException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
