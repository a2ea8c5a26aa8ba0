package com.bridgewatcher.orchestrator;

/**
 * Invoked once when the watcher reaches FAILED.
 */
@FunctionalInterface
public interface WatcherTerminationHandler {

    void onFatalError(Throwable cause);
}
