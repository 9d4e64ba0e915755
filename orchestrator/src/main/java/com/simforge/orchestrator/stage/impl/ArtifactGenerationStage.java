package com.simforge.orchestrator.stage.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.simforge.orchestrator.error.FailureKind;
import com.simforge.orchestrator.error.StageException;
import com.simforge.orchestrator.model.Artifact;
import com.simforge.orchestrator.model.EnrichedEntity;
import com.simforge.orchestrator.model.EnrichedPlan;
import com.simforge.orchestrator.model.MaterialProperties;
import com.simforge.orchestrator.model.PhysicsSettings;
import com.simforge.orchestrator.model.Plan;
import com.simforge.orchestrator.model.StageName;
import com.simforge.orchestrator.stage.Stage;
import com.simforge.orchestrator.stage.StageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Renders an enriched plan into a Blender Python script.
 *
 * The script is the {@code scripts/scene_builder.py} template with the plan's
 * parameters embedded as a JSON string literal, which is also a valid Python
 * string literal. Output is deterministic for a given plan, job and iteration.
 */
public class ArtifactGenerationStage implements Stage<EnrichedPlan, Artifact> {

    private static final Logger log = LoggerFactory.getLogger(ArtifactGenerationStage.class);

    static final String TEMPLATE_RESOURCE = "scripts/scene_builder.py";
    static final String PARAMS_PLACEHOLDER = "{{PARAMS_JSON}}";

    private final Path         outputDir;
    private final ObjectMapper objectMapper;
    private final String       template;

    public ArtifactGenerationStage(Path outputDir, ObjectMapper objectMapper) {
        this.outputDir    = outputDir;
        this.objectMapper = objectMapper;
        this.template     = loadTemplate();
    }

    @Override
    public StageName name() {
        return StageName.GENERATE_ARTIFACT;
    }

    @Override
    public Artifact execute(EnrichedPlan enriched, StageContext ctx) {
        Plan plan = enriched.plan();
        String outputRef = outputDir
                .resolve("job-" + ctx.jobId() + "-i" + ctx.iteration() + ".blend")
                .toAbsolutePath()
                .toString();

        String paramsLiteral;
        try {
            String paramsJson = objectMapper.writeValueAsString(parameters(enriched, outputRef));
            paramsLiteral = objectMapper.writeValueAsString(paramsJson);
        } catch (JsonProcessingException e) {
            throw new StageException(FailureKind.UNKNOWN, "Could not serialise scene parameters", e);
        }

        String script = template.replace(PARAMS_PLACEHOLDER, paramsLiteral);
        double complexity = complexity(plan);
        Artifact artifact = new Artifact(script, "scene_builder/" + plan.simulationType().wireValue(),
                complexity, outputRef);
        log.info("Generated {} line script (complexity {})", artifact.lineCount(),
                String.format("%.2f", complexity));
        return artifact;
    }

    /**
     * Estimated cost of running a plan, 0..1. Driven by simulation type,
     * object count, duration and fluid resolution.
     */
    public static double complexity(Plan plan) {
        double score = switch (plan.simulationType()) {
            case RIGID_BODY   -> 0.2;
            case CLOTH        -> 0.4;
            case FLUID_SMOKE  -> 0.5;
            case FLUID_FIRE   -> 0.6;
            case FLUID_LIQUID -> 0.7;
            default           -> 0.3;
        };
        int objects = plan.totalObjectCount();
        if (objects > 100) {
            score += 0.2;
        } else if (objects > 50) {
            score += 0.1;
        }
        if (plan.durationFrames() > 300) {
            score += 0.1;
        }
        Integer resolution = plan.physics().resolutionMax();
        if (resolution != null && resolution > 200) {
            score += 0.2;
        }
        return Math.min(score, 1.0);
    }

    private ObjectNode parameters(EnrichedPlan enriched, String outputRef) {
        Plan plan = enriched.plan();
        ObjectNode root = objectMapper.createObjectNode();
        root.put("simulation_type", plan.simulationType().wireValue());
        root.put("duration_frames", plan.durationFrames());
        root.put("frame_rate", plan.frameRate());
        root.put("output_path", outputRef);

        PhysicsSettings p = plan.physics();
        ObjectNode physics = root.putObject("physics")
                .put("gravity", p.gravity())
                .put("substeps_per_frame", p.substepsPerFrame())
                .put("solver_iterations", p.solverIterations())
                .put("time_scale", p.timeScale());
        physics.put("resolution_max", p.resolutionMax() == null
                ? PhysicsSettings.DEFAULT_FLUID_RESOLUTION : p.resolutionMax());

        ArrayNode entities = root.putArray("entities");
        for (EnrichedEntity e : enriched.entities()) {
            MaterialProperties m = e.properties();
            ObjectNode node = entities.addObject()
                    .put("name", e.descriptor().name())
                    .put("shape", e.descriptor().shape().wireValue())
                    .put("count", e.descriptor().count())
                    .put("scale", e.descriptor().scale())
                    .put("is_static", e.descriptor().isStatic());
            node.putObject("material")
                    .put("name", m.name())
                    .put("density", m.density())
                    .put("friction", m.friction())
                    .put("restitution", m.restitution())
                    .put("linear_damping", m.linearDamping())
                    .put("angular_damping", m.angularDamping());
        }
        return root;
    }

    private static String loadTemplate() {
        try (InputStream in = new ClassPathResource(TEMPLATE_RESOURCE).getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Missing script template " + TEMPLATE_RESOURCE, e);
        }
    }
}
