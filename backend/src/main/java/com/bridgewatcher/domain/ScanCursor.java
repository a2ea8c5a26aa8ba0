package com.bridgewatcher.domain;

import java.util.OptionalLong;

/**
 * In-memory pointer to the last block height whose events were fully handed off. Non-decreasing.
 * Not thread-safe: a single worker owns it.
 */
public class ScanCursor {

    private long lastProcessedHeight = -1L;
    private boolean initialized;

    public boolean isInitialized() {
        return initialized;
    }

    public OptionalLong getLastProcessedHeight() {
        return initialized ? OptionalLong.of(lastProcessedHeight) : OptionalLong.empty();
    }

    /** First height not yet processed. */
    public long nextHeight() {
        requireInitialized();
        return lastProcessedHeight + 1;
    }

    /**
     * Sets the starting point. Height -1 means "nothing processed yet", so scanning starts at block 0.
     */
    public void initialize(long height) {
        if (initialized) {
            throw new IllegalStateException("Cursor already initialized at " + lastProcessedHeight);
        }
        if (height < -1) {
            throw new IllegalArgumentException("Cursor height must be >= -1: " + height);
        }
        this.lastProcessedHeight = height;
        this.initialized = true;
    }

    /**
     * Moves the cursor forward. Advancing to the current height is a no-op; a lower height is rejected.
     */
    public void advanceTo(long height) {
        requireInitialized();
        if (height < lastProcessedHeight) {
            throw new IllegalArgumentException(
                    "Cursor cannot regress from " + lastProcessedHeight + " to " + height);
        }
        this.lastProcessedHeight = height;
    }

    private void requireInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Cursor not initialized");
        }
    }

    @Override
    public String toString() {
        return initialized ? "ScanCursor[" + lastProcessedHeight + "]" : "ScanCursor[uninitialized]";
    }
}
