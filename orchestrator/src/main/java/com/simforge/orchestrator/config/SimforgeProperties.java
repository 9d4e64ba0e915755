package com.simforge.orchestrator.config;

import com.simforge.orchestrator.model.MaterialProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Externalized settings under the {@code simforge} prefix.
 *
 * Bound once at startup and converted with {@link #toPipelineConfig()}; the
 * pipeline itself only ever sees the immutable {@link PipelineConfig}.
 */
@ConfigurationProperties(prefix = "simforge")
public record SimforgeProperties(
        @DefaultValue Quality    quality,
        @DefaultValue Refinement refinement,
        @DefaultValue Retry      retry,
        @DefaultValue Timeouts   timeouts,
        @DefaultValue Execution  execution,
        @DefaultValue Jobs       jobs,
        @DefaultValue("output") String outputDir,
        Map<String, Material>    materials,
        @DefaultValue("default") String materialsDefault
) {

    public record Quality(@DefaultValue("0.8") double threshold) {}

    public record Refinement(@DefaultValue("5") int maxIterationsCap) {}

    public record Retry(
            @DefaultValue("3")    int      maxStageAttempts,
            @DefaultValue("2")    int      validationMaxAttempts,
            @DefaultValue("1s")   Duration initialBackoff,
            @DefaultValue("30s")  Duration maxBackoff,
            @DefaultValue("2.0")  double   multiplier,
            @DefaultValue("0.2")  double   jitter
    ) {}

    public record Timeouts(
            @DefaultValue("60s") Duration generative,
            @DefaultValue("5m")  Duration execution,
            @DefaultValue("60s") Duration inspection
    ) {}

    public record Execution(@DefaultValue("2") int maxConcurrent) {}

    public record Jobs(@DefaultValue("4") int workers) {}

    public record Material(
            double density,
            double friction,
            double restitution,
            double linearDamping,
            double angularDamping
    ) {}

    public PipelineConfig toPipelineConfig() {
        return new PipelineConfig(
                quality.threshold(),
                refinement.maxIterationsCap(),
                retry.maxStageAttempts(),
                retry.validationMaxAttempts(),
                retry.initialBackoff(),
                retry.maxBackoff(),
                retry.multiplier(),
                retry.jitter(),
                timeouts.generative(),
                timeouts.execution(),
                timeouts.inspection(),
                execution.maxConcurrent(),
                Path.of(outputDir),
                jobs.workers());
    }

    /** Catalog entries in configuration order, validated. */
    public Map<String, MaterialProperties> materialCatalog() {
        Map<String, MaterialProperties> catalog = new LinkedHashMap<>();
        if (materials != null) {
            materials.forEach((name, m) -> catalog.put(name, new MaterialProperties(
                    name, m.density(), m.friction(), m.restitution(), m.linearDamping(), m.angularDamping())));
        }
        return catalog;
    }
}
