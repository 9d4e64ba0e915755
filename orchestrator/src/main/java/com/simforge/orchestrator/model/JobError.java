package com.simforge.orchestrator.model;

import com.simforge.orchestrator.error.FailureKind;

/**
 * A classified failure recorded on a job result.
 *
 * @param stage           stage key the failure happened in, null if outside any stage
 * @param suggestedAction caller-facing hint, may be null
 * @param diagnostics     captured external output, may be null
 */
public record JobError(
        FailureKind kind,
        String      stage,
        String      message,
        String      suggestedAction,
        String      diagnostics
) {}
