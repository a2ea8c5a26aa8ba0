package com.bridgewatcher.ingestion.scan;

import com.bridgewatcher.domain.EventRecord;
import com.bridgewatcher.domain.ScanCursor;
import com.bridgewatcher.ingestion.adapter.EventSelector;
import com.bridgewatcher.ingestion.adapter.LedgerClient;
import com.bridgewatcher.ingestion.adapter.LedgerFatalException;
import com.bridgewatcher.ingestion.adapter.LedgerUnavailableException;
import com.bridgewatcher.ingestion.adapter.RawLogEntry;
import com.bridgewatcher.ingestion.config.LedgerProperties;
import com.bridgewatcher.ingestion.decode.BridgeEventDecoder;
import com.bridgewatcher.ingestion.decode.EventDecodingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Discovers bridge events in confirmed blocks and owns the scan cursor.
 *
 * <p>Each {@link #scan()} covers {@code [lastProcessedHeight + 1, min(head - confirmationDelay,
 * lastProcessedHeight + maxRangeSize)]}. The cursor only moves in {@link #commit(ScanBatch)}, so until the
 * caller commits, every scan returns the same range and records for the same ledger state.
 *
 * <p>Reorganizations deeper than the confirmation delay are not detected; logs the node flags as removed are
 * skipped as decoding errors.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventScanner {

    private final LedgerClient ledgerClient;
    private final BridgeEventDecoder decoder;
    private final EventSelector selector;
    private final LedgerProperties properties;
    private final ScanCursor cursor = new ScanCursor();

    private Long sourceChainId;
    private int consecutiveFailures;

    /**
     * Resolves the source chain id against the node. Called once before the first scan.
     *
     * @throws WatcherConfigurationException if the node reports a different chain than configured
     * @throws LedgerUnavailableException     if the node cannot be reached; counts toward the failure limit
     * @throws LedgerFatalException           if the node rejects the request, or the failure limit is reached
     */
    public void prepare() {
        long nodeChainId;
        try {
            nodeChainId = ledgerClient.getChainId();
        } catch (LedgerUnavailableException e) {
            countFailure(e);
            throw e;
        }
        consecutiveFailures = 0;
        Long configured = properties.sourceChainId();
        if (configured != null && configured != nodeChainId) {
            throw new WatcherConfigurationException("Configured source chain id " + configured
                    + " does not match chain id " + nodeChainId + " reported by the ledger");
        }
        this.sourceChainId = nodeChainId;
        log.info("Connected to source ledger: chainId={}, contract={}, event={} topic={}",
                nodeChainId, selector.contractAddress(), selector.signature(), selector.topic());
    }

    /**
     * Fetches and decodes the next confirmed range without moving the cursor.
     *
     * @throws LedgerFatalException when the ledger rejects the request permanently, or stays unavailable for
     *                              more consecutive polls than configured
     */
    public ScanBatch scan() {
        if (sourceChainId == null) {
            throw new IllegalStateException("prepare() must run before scan()");
        }
        try {
            ScanBatch batch = doScan();
            consecutiveFailures = 0;
            return batch;
        } catch (LedgerUnavailableException e) {
            countFailure(e);
            log.warn("Ledger unavailable (failure {} in a row), cursor stays at {}: {}",
                    consecutiveFailures, cursor, e.getMessage());
            return ScanBatch.ledgerUnavailable();
        }
    }

    private void countFailure(LedgerUnavailableException e) {
        consecutiveFailures++;
        int limit = properties.maxConsecutiveFailures();
        if (limit > 0 && consecutiveFailures >= limit) {
            throw new LedgerFatalException("Ledger unavailable for " + consecutiveFailures
                    + " consecutive polls, giving up", e);
        }
    }

    private ScanBatch doScan() {
        long currentHeight = ledgerClient.getLatestHeight();
        long safeHeight = currentHeight - properties.confirmationDelay();
        if (!cursor.isInitialized()) {
            initializeCursor(safeHeight);
        }
        long fromHeight = cursor.nextHeight();
        if (safeHeight < fromHeight) {
            log.debug("No new confirmed blocks: head={}, safe={}, next={}", currentHeight, safeHeight, fromHeight);
            return ScanBatch.nothingToScan();
        }
        long toHeight = Math.min(safeHeight, fromHeight - 1 + properties.maxRangeSize());

        log.info("Scanning blocks [{}-{}] (head={}, confirmations={})",
                fromHeight, toHeight, currentHeight, properties.confirmationDelay());
        List<RawLogEntry> logs = ledgerClient.getEvents(fromHeight, toHeight, selector);

        Map<String, EventRecord> byLogKey = new LinkedHashMap<>();
        int skipped = 0;
        for (RawLogEntry entry : logs) {
            try {
                EventRecord record = decoder.decode(entry, selector, sourceChainId);
                if (record.blockNumber() < fromHeight || record.blockNumber() > toHeight) {
                    throw new EventDecodingException("Block " + record.blockNumber() + " outside requested range ["
                            + fromHeight + "-" + toHeight + "]");
                }
                if (byLogKey.putIfAbsent(record.logKey(), record) != null) {
                    log.debug("Duplicate log {} dropped", record.logKey());
                }
            } catch (EventDecodingException e) {
                skipped++;
                log.warn("Skipping undecodable log in [{}-{}]: {}", fromHeight, toHeight, e.getMessage());
            }
        }
        List<EventRecord> records = new ArrayList<>(byLogKey.values());
        records.sort(EventRecord.CANONICAL_ORDER);

        if (!records.isEmpty() || skipped > 0) {
            log.info("Found {} event(s) in [{}-{}], {} skipped", records.size(), fromHeight, toHeight, skipped);
        }
        return ScanBatch.scanned(fromHeight, toHeight, records, skipped);
    }

    private void initializeCursor(long safeHeight) {
        Long startHeight = properties.startHeight();
        long initial = startHeight != null
                ? startHeight - 1
                : Math.max(-1L, safeHeight - properties.startLookbackBlocks());
        cursor.initialize(initial);
        log.info("Scan cursor initialized at {} (next block {})", initial, initial + 1);
    }

    /**
     * Advances the cursor to the end of a fully resolved batch. Batches without a range are ignored.
     */
    public void commit(ScanBatch batch) {
        OptionalLong height = batch.commitHeight();
        if (height.isEmpty()) {
            return;
        }
        OptionalLong previous = cursor.getLastProcessedHeight();
        if (previous.isPresent() && height.getAsLong() < previous.getAsLong()) {
            throw new IllegalStateException("Stale batch " + batch.describeRange() + " behind cursor " + cursor);
        }
        cursor.advanceTo(height.getAsLong());
        log.info("Cursor advanced to {} after batch {}", height.getAsLong(), batch.describeRange());
    }

    public OptionalLong getLastProcessedHeight() {
        return cursor.getLastProcessedHeight();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }
}
