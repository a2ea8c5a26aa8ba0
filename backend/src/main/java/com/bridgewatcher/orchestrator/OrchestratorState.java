package com.bridgewatcher.orchestrator;

/**
 * Watcher lifecycle. NEW → STARTING → RUNNING → STOPPING → STOPPED; FAILED is terminal and reachable from
 * STARTING or RUNNING.
 */
public enum OrchestratorState {
    NEW,
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED,
    FAILED;

    public boolean isTerminal() {
        return this == STOPPED || this == FAILED;
    }
}
