package com.simforge.orchestrator.service;

import com.simforge.orchestrator.config.PipelineConfig;
import com.simforge.orchestrator.execution.BlenderProcessRunner;
import com.simforge.orchestrator.execution.ExecutionLimiter;
import com.simforge.orchestrator.generative.ClaudeClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Readiness of the pipeline's external dependencies, exposed on
 * {@code /actuator/health}.
 *
 * DOWN when the generative API key is missing, the Blender executable cannot
 * be found, or the output directory cannot be created.
 */
@Component("pipeline")
public class PipelineHealthIndicator implements HealthIndicator {

    private final ClaudeClient         claude;
    private final BlenderProcessRunner blender;
    private final ExecutionLimiter     limiter;
    private final JobRegistry          registry;
    private final PipelineConfig       config;

    public PipelineHealthIndicator(ClaudeClient claude, BlenderProcessRunner blender,
                                   ExecutionLimiter limiter, JobRegistry registry,
                                   PipelineConfig config) {
        this.claude   = claude;
        this.blender  = blender;
        this.limiter  = limiter;
        this.registry = registry;
        this.config   = config;
    }

    @Override
    public Health health() {
        boolean apiKey    = claude.isConfigured();
        boolean blenderOk = isRunnable(blender.executable());
        boolean outputOk  = outputDirUsable(config.outputDir());

        Health.Builder builder = (apiKey && blenderOk && outputOk) ? Health.up() : Health.down();
        return builder
                .withDetail("generativeApiKey", apiKey ? "configured" : "missing")
                .withDetail("blenderExecutable", blender.executable() + (blenderOk ? "" : " (not found)"))
                .withDetail("outputDir", config.outputDir().toAbsolutePath() + (outputOk ? "" : " (not writable)"))
                .withDetail("executionsHeld", limiter.heldCount() + "/" + limiter.capacity())
                .withDetail("activeJobs", registry.countActive())
                .build();
    }

    static boolean isRunnable(String executable) {
        if (executable == null || executable.isBlank()) {
            return false;
        }
        Path direct = Path.of(executable);
        if (executable.contains(File.separator)) {
            return Files.isExecutable(direct);
        }
        String path = System.getenv("PATH");
        if (path == null) {
            return false;
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (!dir.isBlank() && Files.isExecutable(Path.of(dir, executable))) {
                return true;
            }
        }
        return false;
    }

    private static boolean outputDirUsable(Path dir) {
        try {
            Files.createDirectories(dir);
            return Files.isWritable(dir);
        } catch (IOException e) {
            return false;
        }
    }
}
