package com.simforge.orchestrator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Terminal record of a job.
 *
 * {@code best} is null only when no attempt reached the quality stage; it is
 * kept even when the job ultimately failed so callers can recover partial work.
 *
 * @param stageTimings stage key → elapsed seconds; refinement iterations use
 *                     keys of the form {@code iteration_<n>/<stage>}
 */
public record JobResult(
        UUID                jobId,
        boolean             success,
        JobState            status,
        Outcome             outcome,
        ScoredAttempt       best,
        int                 refinementIterations,
        Map<String, Double> stageTimings,
        List<String>        warnings,
        List<JobError>      errors
) {
    public JobResult {
        stageTimings = Collections.unmodifiableMap(new LinkedHashMap<>(stageTimings));
        warnings     = List.copyOf(warnings);
        errors       = List.copyOf(errors);
    }

    public QualityMetrics qualityMetrics() {
        return best == null ? null : best.metrics();
    }

    public double totalSeconds() {
        return stageTimings.values().stream().mapToDouble(Double::doubleValue).sum();
    }
}
