package com.bridgewatcher.ingestion.adapter;

import java.util.List;

/**
 * One event log as returned by the ledger, before decoding. Numeric fields are null when the node omitted them
 * or sent something unparseable; the decoder rejects such entries.
 */
public record RawLogEntry(
        String address,
        List<String> topics,
        String data,
        String transactionHash,
        Long blockNumber,
        Long logIndex,
        boolean removed
) {

    public RawLogEntry {
        topics = topics != null ? List.copyOf(topics) : List.of();
    }

    /** Short provenance label for logs. */
    public String describe() {
        return "tx=" + transactionHash + " block=" + blockNumber + " logIndex=" + logIndex;
    }
}
