package com.bridgewatcher.ingestion.adapter;

import java.util.List;

/**
 * Read-only access to the source ledger.
 * Every method throws {@link LedgerUnavailableException} for transient failures and
 * {@link LedgerFatalException} for failures that retrying cannot fix.
 */
public interface LedgerClient {

    /**
     * Current head block number (inclusive).
     */
    long getLatestHeight();

    /**
     * Chain id reported by the node.
     */
    long getChainId();

    /**
     * Logs matching the selector in {@code [fromHeight, toHeight]}, both inclusive. Empty when fromHeight > toHeight.
     * Order is whatever the node returns; callers sort.
     */
    List<RawLogEntry> getEvents(long fromHeight, long toHeight, EventSelector eventSelector);
}
