package com.simforge.orchestrator.stage;

import com.simforge.orchestrator.progress.ProgressReporter;

import java.util.UUID;

/**
 * Runtime context passed to every stage execution.
 *
 * @param attempt   1-based attempt number of this stage within the retry loop
 * @param iteration refinement iteration (0 = initial attempt)
 */
public record StageContext(UUID jobId, int attempt, int iteration, ProgressReporter progress) {

    public boolean isRetry() {
        return attempt > 1;
    }
}
