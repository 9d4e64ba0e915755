package com.simforge.orchestrator.model;

/** How a job ended. */
public enum Outcome {
    /** An attempt met the quality threshold. */
    ACCEPTED,
    /** Refinement was disabled and the only attempt scored below threshold. */
    BELOW_THRESHOLD,
    /** The refinement budget ran out; the best attempt seen is returned. */
    EXHAUSTED_FALLBACK,
    /** A fatal or budget-exhausted stage failure, or a cancellation. */
    FAILED
}
