package com.simforge.orchestrator.error;

/**
 * Verdict of the {@link ErrorClassifier} for one failure.
 *
 * @param suggestedAction caller-facing hint, may be null
 * @param diagnostics     captured external output, may be null
 */
public record Classification(
        FailureKind kind,
        boolean     retryable,
        String      message,
        String      suggestedAction,
        String      diagnostics
) {}
