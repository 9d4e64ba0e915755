package com.simforge.orchestrator.model;

/**
 * Lifecycle of a simulation Job.
 *
 * Transitions:
 *   PENDING → RUNNING → SUCCEEDED
 *   RUNNING → REFINING → RUNNING ... (one round trip per refinement iteration)
 *
 * Any non-terminal state can transition to FAILED on a fatal stage error,
 * an exhausted retry budget, or a cancellation request.
 */
public enum JobState {
    PENDING,
    RUNNING,
    REFINING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
