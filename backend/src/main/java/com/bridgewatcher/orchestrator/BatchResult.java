package com.bridgewatcher.orchestrator;

import com.bridgewatcher.domain.EventRecord;
import com.bridgewatcher.ingestion.scan.ScanBatch;

/**
 * What one tick did with its batch.
 *
 * @param batch     the scanned batch
 * @param delivered records delivered (including ones already delivered earlier)
 * @param rejected  records permanently rejected
 * @param heldAt    the record whose delivery failed retryably, or null when the batch resolved
 * @param committed whether the cursor moved to the end of the batch
 */
public record BatchResult(ScanBatch batch, int delivered, int rejected, EventRecord heldAt, boolean committed) {

    static BatchResult nothingScanned(ScanBatch batch) {
        return new BatchResult(batch, 0, 0, null, false);
    }

    public boolean isResolved() {
        return heldAt == null;
    }
}
