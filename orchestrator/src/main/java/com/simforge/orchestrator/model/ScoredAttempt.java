package com.simforge.orchestrator.model;

/**
 * Everything one attempt produced on its way through the quality stage.
 *
 * @param sequence  0-based order in which attempts reached scoring within a job
 * @param iteration refinement iteration the attempt belongs to (0 = initial)
 */
public record ScoredAttempt(
        int               sequence,
        int               iteration,
        Plan              plan,
        EnrichedPlan      enrichedPlan,
        Artifact          artifact,
        ValidationOutcome validation,
        ExecutionRecord   execution,
        QualityMetrics    metrics
) {
    public double score() {
        return metrics.score();
    }
}
