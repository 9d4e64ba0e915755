package com.simforge.orchestrator.error;

/**
 * Failure taxonomy shared by every stage.
 *
 * Retryable kinds are retried by the orchestrator up to their attempt budget
 * (see {@link com.simforge.orchestrator.service.RetryPolicy}); the others abort
 * the job on first occurrence.
 */
public enum FailureKind {

    /** Generative service returned unusable or schema-invalid structure. */
    PLANNING_FAILURE(true, "Rephrase the simulation request with more specific details"),

    /** A material could not be resolved even through the fallback. */
    ENRICHMENT_FAILURE(false, "Check the materials catalog and its default entry"),

    /** Generated script failed structural or safety checks. The retry applies the auto-fix. */
    VALIDATION_FAILURE(true, "Simplify the request; the generated script failed safety checks"),

    /** External environment completed abnormally. */
    EXECUTION_FAILURE(true, "Inspect the captured Blender output in the error diagnostics"),

    /** An external call exceeded its deadline. */
    TIMEOUT(true, "Retry later or reduce the scene size; an external call did not finish in time"),

    /** The caller cancelled the job. */
    CANCELLED(false, null),

    /** Anything else. Never retried. */
    UNKNOWN(false, "Report this failure; it was not expected by the pipeline");

    private final boolean retryable;
    private final String  suggestedAction;

    FailureKind(boolean retryable, String suggestedAction) {
        this.retryable       = retryable;
        this.suggestedAction = suggestedAction;
    }

    public boolean retryable()       { return retryable; }
    public String  suggestedAction() { return suggestedAction; }
}
