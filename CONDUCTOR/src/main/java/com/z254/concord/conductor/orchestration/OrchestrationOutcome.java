package com.z254.concord.conductor.orchestration;

/**
 * How a routing loop ended.
 */
public enum OrchestrationOutcome {

    /** The routing engine answered END. */
    COMPLETED,

    /** The configured number of routing cycles ran without reaching END. */
    ITERATION_LIMIT,

    /** A cycle failed; the open turn was closed with the failure recorded. */
    FAILED,

    /** The loop was stopped while waiting on a delegation. */
    CANCELLED
}
