package com.simforge.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.simforge.orchestrator.error.ErrorClassifier;
import com.simforge.orchestrator.execution.BlenderProcessRunner;
import com.simforge.orchestrator.execution.ExecutionLimiter;
import com.simforge.orchestrator.generative.GenerativeService;
import com.simforge.orchestrator.materials.MaterialCatalog;
import com.simforge.orchestrator.service.PipelineOrchestrator;
import com.simforge.orchestrator.service.PipelineStages;
import com.simforge.orchestrator.service.RefinementLoop;
import com.simforge.orchestrator.service.RetryPolicy;
import com.simforge.orchestrator.service.Sleeper;
import com.simforge.orchestrator.service.StageRunner;
import com.simforge.orchestrator.stage.CallDeadline;
import com.simforge.orchestrator.stage.impl.ArtifactGenerationStage;
import com.simforge.orchestrator.stage.impl.ArtifactValidationStage;
import com.simforge.orchestrator.stage.impl.EnrichmentStage;
import com.simforge.orchestrator.stage.impl.ExecutionStage;
import com.simforge.orchestrator.stage.impl.PlanningStage;
import com.simforge.orchestrator.stage.impl.QualityScoringStage;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the pipeline: configuration, shared resources, the six stages and
 * the orchestrator that runs them.
 */
@Configuration
@EnableConfigurationProperties(SimforgeProperties.class)
public class PipelineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfiguration.class);

    @Bean
    public PipelineConfig pipelineConfig(SimforgeProperties properties) {
        PipelineConfig config = properties.toPipelineConfig();
        log.info("Pipeline config: threshold={}, refinementCap={}, stageAttempts={}, executions={}, workers={}",
                config.qualityThreshold(), config.maxRefinementIterationsCap(), config.maxStageAttempts(),
                config.maxConcurrentExecutions(), config.workers());
        return config;
    }

    @Bean
    public MaterialCatalog materialCatalog(SimforgeProperties properties) {
        MaterialCatalog catalog = new MaterialCatalog(properties.materialCatalog(), properties.materialsDefault());
        if (catalog.fallback().isEmpty()) {
            log.warn("Default material '{}' is not in the catalog; unknown materials will fail enrichment",
                    properties.materialsDefault());
        }
        return catalog;
    }

    // ------------------------------------------------------------------
    // Shared resources
    // ------------------------------------------------------------------

    @Bean
    public ExecutionLimiter executionLimiter(PipelineConfig config, MeterRegistry meterRegistry) {
        ExecutionLimiter limiter = new ExecutionLimiter(config.maxConcurrentExecutions());
        Gauge.builder("simforge.execution.held", limiter, ExecutionLimiter::heldCount)
                .description("Execution slots currently held")
                .register(meterRegistry);
        return limiter;
    }

    /** One thread per job; a job runs all its stages on the same worker. */
    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("jobWorkers")
    public ExecutorService jobWorkers(PipelineConfig config) {
        return Executors.newFixedThreadPool(config.workers(), named("job-worker-"));
    }

    /** Threads that block on external calls while the job thread waits with a deadline. */
    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("externalCalls")
    public ExecutorService externalCalls() {
        return Executors.newCachedThreadPool(named("external-call-"));
    }

    @Bean
    public CallDeadline callDeadline(@Qualifier("externalCalls") ExecutorService externalCalls) {
        return new CallDeadline(externalCalls);
    }

    // ------------------------------------------------------------------
    // Stages and orchestration
    // ------------------------------------------------------------------

    @Bean
    public PipelineStages pipelineStages(PipelineConfig config,
                                         GenerativeService generative,
                                         MaterialCatalog materials,
                                         BlenderProcessRunner blender,
                                         ExecutionLimiter limiter,
                                         CallDeadline deadline,
                                         ObjectMapper objectMapper) {
        return new PipelineStages(
                new PlanningStage(generative, deadline, config.generativeTimeout(), objectMapper),
                new EnrichmentStage(materials),
                new ArtifactGenerationStage(config.outputDir(), objectMapper),
                new ArtifactValidationStage(),
                new ExecutionStage(blender, blender, limiter, deadline,
                        config.executionTimeout(), config.inspectionTimeout()),
                new QualityScoringStage());
    }

    @Bean
    public StageRunner stageRunner(PipelineConfig config, ErrorClassifier classifier, MeterRegistry meterRegistry) {
        return new StageRunner(classifier, new RetryPolicy(config), Sleeper.SYSTEM, meterRegistry);
    }

    @Bean
    public PipelineOrchestrator pipelineOrchestrator(PipelineStages stages,
                                                     StageRunner runner,
                                                     PipelineConfig config,
                                                     ErrorClassifier classifier,
                                                     MeterRegistry meterRegistry) {
        return new PipelineOrchestrator(stages, runner, new RefinementLoop(config), classifier, meterRegistry);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
