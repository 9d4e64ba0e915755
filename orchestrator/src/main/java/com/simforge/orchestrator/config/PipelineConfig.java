package com.simforge.orchestrator.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Immutable pipeline settings, resolved once at startup from
 * {@link SimforgeProperties} and handed to the orchestrator's collaborators.
 */
public record PipelineConfig(
        double   qualityThreshold,
        int      maxRefinementIterationsCap,
        int      maxStageAttempts,
        int      validationMaxAttempts,
        Duration initialBackoff,
        Duration maxBackoff,
        double   backoffMultiplier,
        double   backoffJitter,
        Duration generativeTimeout,
        Duration executionTimeout,
        Duration inspectionTimeout,
        int      maxConcurrentExecutions,
        Path     outputDir,
        int      workers
) {
    public PipelineConfig {
        if (qualityThreshold < 0 || qualityThreshold > 1) {
            throw new IllegalArgumentException("qualityThreshold must be within 0..1, got " + qualityThreshold);
        }
        if (maxRefinementIterationsCap < 0) {
            throw new IllegalArgumentException("maxRefinementIterationsCap must be >= 0");
        }
        if (maxStageAttempts < 1 || validationMaxAttempts < 1) {
            throw new IllegalArgumentException("attempt budgets must be >= 1");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1");
        }
        if (backoffJitter < 0 || backoffJitter >= 1) {
            throw new IllegalArgumentException("backoffJitter must be within [0, 1)");
        }
        if (maxConcurrentExecutions < 1 || workers < 1) {
            throw new IllegalArgumentException("maxConcurrentExecutions and workers must be >= 1");
        }
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(
                0.8, 5, 3, 2,
                Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, 0.2,
                Duration.ofSeconds(60), Duration.ofMinutes(5), Duration.ofSeconds(60),
                2, Path.of("output"), 4);
    }
}
