package com.bridgewatcher.ingestion.scan;

import com.bridgewatcher.domain.EventRecord;
import lombok.Getter;

import java.util.List;
import java.util.OptionalLong;

/**
 * Output of one {@link EventScanner#scan()}: the scanned block range and its records in canonical order.
 * Only a SCANNED batch carries a range and can be committed.
 */
@Getter
public final class ScanBatch {

    public enum Status {
        /** A range was fetched; records may still be empty. */
        SCANNED,
        /** No new block is past the confirmation depth. */
        NOTHING_TO_SCAN,
        /** The ledger could not be reached this tick; retried on the next poll. */
        LEDGER_UNAVAILABLE
    }

    private static final ScanBatch NOTHING_TO_SCAN = new ScanBatch(Status.NOTHING_TO_SCAN, -1L, -1L, List.of(), 0);

    private final Status status;
    private final long fromHeight;
    private final long toHeight;
    private final List<EventRecord> records;
    /** Logs in the range that failed to decode and were skipped. */
    private final int skippedLogs;

    private ScanBatch(Status status, long fromHeight, long toHeight, List<EventRecord> records, int skippedLogs) {
        this.status = status;
        this.fromHeight = fromHeight;
        this.toHeight = toHeight;
        this.records = List.copyOf(records);
        this.skippedLogs = skippedLogs;
    }

    public static ScanBatch scanned(long fromHeight, long toHeight, List<EventRecord> records, int skippedLogs) {
        if (fromHeight > toHeight) {
            throw new IllegalArgumentException("Empty range [" + fromHeight + "-" + toHeight + "]");
        }
        return new ScanBatch(Status.SCANNED, fromHeight, toHeight, records, skippedLogs);
    }

    public static ScanBatch nothingToScan() {
        return NOTHING_TO_SCAN;
    }

    public static ScanBatch ledgerUnavailable() {
        return new ScanBatch(Status.LEDGER_UNAVAILABLE, -1L, -1L, List.of(), 0);
    }

    public boolean hasRange() {
        return status == Status.SCANNED;
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public OptionalLong commitHeight() {
        return hasRange() ? OptionalLong.of(toHeight) : OptionalLong.empty();
    }

    public String describeRange() {
        return hasRange() ? "[" + fromHeight + "-" + toHeight + "]" : status.name();
    }

    @Override
    public String toString() {
        return "ScanBatch" + describeRange() + " records=" + records.size() + " skipped=" + skippedLogs;
    }
}
