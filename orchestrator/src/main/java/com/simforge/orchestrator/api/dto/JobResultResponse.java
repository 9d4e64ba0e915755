package com.simforge.orchestrator.api.dto;

import com.simforge.orchestrator.model.JobError;
import com.simforge.orchestrator.model.JobResult;
import com.simforge.orchestrator.model.Plan;
import com.simforge.orchestrator.model.QualityMetrics;
import com.simforge.orchestrator.model.ScoredAttempt;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Response body for GET /jobs/{id}/result once the job is terminal.
 *
 * Artifact fields describe the best attempt; they are null when no attempt
 * reached scoring.
 */
public record JobResultResponse(
        UUID                jobId,
        boolean             success,
        String              status,
        String              outcome,
        Double              qualityScore,
        QualityMetrics      qualityMetrics,
        Plan                plan,
        String              script,
        String              templateKey,
        Double              complexity,
        String              outputRef,
        int                 refinementIterations,
        Map<String, Double> stageTimings,
        double              totalSeconds,
        List<String>        warnings,
        List<JobError>      errors
) {
    public static JobResultResponse from(JobResult r) {
        ScoredAttempt best = r.best();
        return new JobResultResponse(
                r.jobId(),
                r.success(),
                r.status().name(),
                r.outcome().name(),
                best == null ? null : best.score(),
                r.qualityMetrics(),
                best == null ? null : best.plan(),
                best == null ? null : best.artifact().script(),
                best == null ? null : best.artifact().templateKey(),
                best == null ? null : best.artifact().complexity(),
                best == null ? null : best.execution().outputRef(),
                r.refinementIterations(),
                r.stageTimings(),
                r.totalSeconds(),
                r.warnings(),
                r.errors()
        );
    }
}
