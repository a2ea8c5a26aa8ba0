package com.bridgewatcher.orchestrator;

import com.bridgewatcher.attestation.AttestationSink;
import com.bridgewatcher.config.AsyncConfig;
import com.bridgewatcher.domain.DeliveryOutcome;
import com.bridgewatcher.domain.EventRecord;
import com.bridgewatcher.ingestion.adapter.LedgerUnavailableException;
import com.bridgewatcher.ingestion.scan.EventScanner;
import com.bridgewatcher.ingestion.scan.ScanBatch;
import com.bridgewatcher.orchestrator.config.WatcherProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the watcher: scan, deliver each record in order, commit the cursor when the whole batch is resolved, sleep.
 *
 * <p>A retryable delivery failure halts the batch without committing, so the next tick re-scans the same range and
 * redelivers from the start of the batch (at-least-once; the attestation API deduplicates by nonce).
 * A permanent rejection is logged as an alert and does not hold the cursor.
 *
 * <p>One worker thread runs the loop. A stop request is honoured between ticks and during the poll sleep; a batch
 * that is being delivered always finishes first.
 */
@Slf4j
@Component
public class BridgeOrchestrator implements SmartLifecycle {

    private final EventScanner scanner;
    private final AttestationSink sink;
    private final WatcherProperties properties;
    private final Executor executor;
    private final WatcherTerminationHandler terminationHandler;

    private final AtomicReference<OrchestratorState> state = new AtomicReference<>(OrchestratorState.NEW);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CompletableFuture<OrchestratorState> termination = new CompletableFuture<>();

    public BridgeOrchestrator(EventScanner scanner,
                              AttestationSink sink,
                              WatcherProperties properties,
                              @Qualifier(AsyncConfig.WATCHER_EXECUTOR) Executor executor,
                              WatcherTerminationHandler terminationHandler) {
        this.scanner = scanner;
        this.sink = sink;
        this.properties = properties;
        this.executor = executor;
        this.terminationHandler = terminationHandler;
    }

    @Override
    public void start() {
        if (!transition(OrchestratorState.NEW, OrchestratorState.STARTING)) {
            log.debug("Start ignored in state {}", state.get());
            return;
        }
        executor.execute(this::run);
    }

    /**
     * Blocks until the loop has ended or the shutdown timeout passes.
     */
    @Override
    public void stop() {
        requestStop();
        try {
            termination.get(properties.shutdownTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (TimeoutException e) {
            log.warn("Watcher did not stop within {}s; state={}", properties.shutdownTimeoutSeconds(), state.get());
        } catch (ExecutionException e) {
            log.warn("Watcher loop ended abnormally", e.getCause());
        }
    }

    @Override
    public void stop(Runnable callback) {
        requestStop();
        termination.whenComplete((finalState, error) -> callback.run());
    }

    @Override
    public boolean isRunning() {
        OrchestratorState current = state.get();
        return current == OrchestratorState.STARTING || current == OrchestratorState.RUNNING
                || current == OrchestratorState.STOPPING;
    }

    public OrchestratorState getState() {
        return state.get();
    }

    /**
     * Completes with the terminal state (STOPPED or FAILED) once the loop has ended.
     */
    public CompletableFuture<OrchestratorState> getTermination() {
        return termination;
    }

    /**
     * Asks the loop to stop after the in-flight batch. Safe to call from any thread, any number of times.
     */
    public void requestStop() {
        if (transition(OrchestratorState.NEW, OrchestratorState.STOPPED)) {
            log.info("Watcher stopped before it was started");
            termination.complete(OrchestratorState.STOPPED);
        } else if (transition(OrchestratorState.RUNNING, OrchestratorState.STOPPING)
                || transition(OrchestratorState.STARTING, OrchestratorState.STOPPING)) {
            log.info("Stop requested; finishing in-flight batch");
        }
        stopSignal.countDown();
    }

    void run() {
        log.info("Bridge watcher starting");
        if (!prepareScanner()) {
            return;
        }
        if (transition(OrchestratorState.STARTING, OrchestratorState.RUNNING)) {
            log.info("Bridge watcher running; polling every {}s", properties.pollingIntervalSeconds());
            try {
                while (state.get() == OrchestratorState.RUNNING) {
                    tick();
                    if (state.get() != OrchestratorState.RUNNING || awaitStop(properties.pollingIntervalSeconds())) {
                        break;
                    }
                }
            } catch (RuntimeException e) {
                fail("Bridge watcher stopped on unrecoverable error", e);
                return;
            }
        }
        state.set(OrchestratorState.STOPPED);
        log.info("Bridge watcher stopped; cursor at {}", describeCursor());
        termination.complete(OrchestratorState.STOPPED);
    }

    /**
     * Retries an unreachable ledger every poll interval until it answers, a stop is requested, or the scanner
     * gives up. Returns false when the watcher has failed.
     */
    private boolean prepareScanner() {
        while (true) {
            try {
                scanner.prepare();
                return true;
            } catch (LedgerUnavailableException e) {
                log.warn("Source ledger unavailable at startup, retrying in {}s: {}",
                        properties.pollingIntervalSeconds(), e.getMessage());
                if (awaitStop(properties.pollingIntervalSeconds())) {
                    return true;
                }
            } catch (RuntimeException e) {
                fail("Bridge watcher failed to start", e);
                return false;
            }
        }
    }

    /**
     * One scan-then-deliver cycle. Runs to completion even if a stop is requested meanwhile.
     */
    public BatchResult tick() {
        ScanBatch batch = scanner.scan();
        if (!batch.hasRange()) {
            return BatchResult.nothingScanned(batch);
        }
        int delivered = 0;
        int rejected = 0;
        for (EventRecord record : batch.getRecords()) {
            DeliveryOutcome outcome = sink.submit(record);
            switch (outcome.getStatus()) {
                case DELIVERED -> delivered++;
                case REJECTED_PERMANENTLY -> {
                    rejected++;
                    log.error("ALERT attestation permanently rejected, record skipped: nonce={} tx={} block={} "
                                    + "logIndex={} reason={}", record.nonce(), record.transactionHash(),
                            record.blockNumber(), record.logIndex(), outcome.getReason().orElse("unknown"));
                }
                case RETRYABLE_FAILURE -> {
                    log.warn("Batch {} halted at nonce={} tx={} block={}: {}. Cursor held at {}; batch retried next poll",
                            batch.describeRange(), record.nonce(), record.transactionHash(), record.blockNumber(),
                            outcome.getReason().orElse("unknown"), describeCursor());
                    return new BatchResult(batch, delivered, rejected, record, false);
                }
            }
        }
        scanner.commit(batch);
        if (!batch.isEmpty()) {
            log.info("Batch {} resolved: {} delivered, {} rejected, {} undecodable",
                    batch.describeRange(), delivered, rejected, batch.getSkippedLogs());
        }
        return new BatchResult(batch, delivered, rejected, null, true);
    }

    private boolean awaitStop(long seconds) {
        try {
            return stopSignal.await(seconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Watcher thread interrupted; stopping");
            if (!transition(OrchestratorState.RUNNING, OrchestratorState.STOPPING)) {
                transition(OrchestratorState.STARTING, OrchestratorState.STOPPING);
            }
            return true;
        }
    }

    private void fail(String message, RuntimeException cause) {
        OrchestratorState previous = state.getAndSet(OrchestratorState.FAILED);
        log.error("{} (state was {}, cursor at {})", message, previous, describeCursor(), cause);
        try {
            terminationHandler.onFatalError(cause);
        } finally {
            termination.complete(OrchestratorState.FAILED);
        }
    }

    private boolean transition(OrchestratorState from, OrchestratorState to) {
        if (state.compareAndSet(from, to)) {
            log.debug("Watcher state {} -> {}", from, to);
            return true;
        }
        return false;
    }

    private String describeCursor() {
        return scanner.getLastProcessedHeight().isPresent()
                ? String.valueOf(scanner.getLastProcessedHeight().getAsLong())
                : "uninitialized";
    }
}
