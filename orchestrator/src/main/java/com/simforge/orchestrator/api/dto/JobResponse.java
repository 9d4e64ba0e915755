package com.simforge.orchestrator.api.dto;

import com.simforge.orchestrator.model.Job;
import com.simforge.orchestrator.progress.ProgressEvent;
import com.simforge.orchestrator.service.TrackedJob;

import java.time.Instant;
import java.util.UUID;

/**
 * Snapshot of a simulation job as returned by POST /jobs and GET /jobs/{id}.
 * Progress is the latest reported fraction (0.0 before any event).
 */
public record JobResponse(
        UUID    id,
        String  state,
        String  currentStage,
        double  progress,
        String  progressMessage,
        boolean cancelRequested,
        Instant createdAt,
        Instant updatedAt
) {
    public static JobResponse from(TrackedJob tracked) {
        Job job = tracked.job();
        ProgressEvent latest = tracked.progress().latest().orElse(null);
        return new JobResponse(
                job.getId(),
                job.getState().name(),
                job.getCurrentStage() == null ? null : job.getCurrentStage().key(),
                latest == null ? 0.0 : latest.fraction(),
                latest == null ? null : latest.message(),
                job.isCancelRequested(),
                job.getCreatedAt(),
                job.getUpdatedAt()
        );
    }
}
