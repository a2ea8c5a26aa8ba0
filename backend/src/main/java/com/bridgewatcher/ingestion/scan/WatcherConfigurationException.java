package com.bridgewatcher.ingestion.scan;

/**
 * Configuration that binds and validates but contradicts what the ledger reports (e.g. wrong chain id).
 */
public class WatcherConfigurationException extends RuntimeException {

    public WatcherConfigurationException(String message) {
        super(message);
    }
}
