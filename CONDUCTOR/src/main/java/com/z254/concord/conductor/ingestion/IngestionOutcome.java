package com.z254.concord.conductor.ingestion;

/**
 * Result of offering one event to ingestion.
 */
public enum IngestionOutcome {
    DISPATCHED,
    DUPLICATE,
    IGNORED,
    REJECTED,
    FAILED,
    NOT_ACCEPTING
}
