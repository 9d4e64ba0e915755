package com.simforge.orchestrator.api.dto;

/**
 * Request body for POST /jobs.
 *
 * Required: request (free-text simulation description)
 * Optional: refinementEnabled (default true), maxRefinementIterations (default 3,
 *   further capped by simforge.refinement.max-iterations-cap)
 */
public record SubmitJobRequest(String request, Boolean refinementEnabled, Integer maxRefinementIterations) {

    public static final int DEFAULT_MAX_REFINEMENT_ITERATIONS = 3;

    public SubmitJobRequest {
        if (refinementEnabled == null) refinementEnabled = Boolean.TRUE;
        if (maxRefinementIterations == null) maxRefinementIterations = DEFAULT_MAX_REFINEMENT_ITERATIONS;
    }
}
