package com.simforge.orchestrator.stage.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.simforge.orchestrator.error.FailureKind;
import com.simforge.orchestrator.error.StageException;
import com.simforge.orchestrator.model.EntityDescriptor;
import com.simforge.orchestrator.model.PhysicsSettings;
import com.simforge.orchestrator.model.Plan;
import com.simforge.orchestrator.model.ShapeType;
import com.simforge.orchestrator.model.SimulationType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Converts the planning tool's JSON output into a {@link Plan} and back.
 *
 * The generative service is not trusted to honour its schema, so every field
 * is checked here. Any violation is a PLANNING_FAILURE, which the orchestrator
 * retries with a fresh call.
 */
public final class PlanParser {

    static final double MIN_SCALE      = 0.1;
    static final double MAX_SCALE      = 100.0;
    static final int    MIN_RESOLUTION = 32;
    static final int    MAX_RESOLUTION = 512;

    // Names end up inside the generated script, so only plain identifiers are accepted.
    static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9_ -]{1,64}");

    private PlanParser() {}

    public static Plan parse(JsonNode input, String request) {
        if (input == null || !input.isObject()) {
            throw invalid("plan must be a JSON object");
        }

        String typeValue = requiredText(input, "simulation_type");
        SimulationType type = SimulationType.fromWire(typeValue)
                .orElseThrow(() -> invalid("unknown simulation_type '" + typeValue + "'"));

        JsonNode objects = input.get("objects");
        if (objects == null || !objects.isArray()) {
            throw invalid("'objects' must be an array");
        }
        List<EntityDescriptor> entities = new ArrayList<>();
        for (int i = 0; i < objects.size(); i++) {
            entities.add(parseEntity(objects.get(i), i));
        }

        int duration = requiredInt(input, "duration_frames");
        if (duration < 1 || duration > Plan.MAX_DURATION_FRAMES) {
            throw invalid("duration_frames must be 1.." + Plan.MAX_DURATION_FRAMES + ", got " + duration);
        }

        PhysicsSettings physics = parsePhysics(input.path("physics_settings"), type);
        return new Plan(type, entities, physics, duration, Plan.DEFAULT_FRAME_RATE, request);
    }

    /**
     * Non-blocking observations about a parsed plan. They end up as job warnings.
     */
    public static List<String> sanityWarnings(Plan plan) {
        List<String> warnings = new ArrayList<>();
        if (plan.entities().isEmpty()) {
            warnings.add("Plan has no objects");
        }
        if (plan.simulationType() == SimulationType.RIGID_BODY
                && plan.entities().stream().noneMatch(EntityDescriptor::isStatic)) {
            warnings.add("Rigid body simulation should have a static ground plane");
        }
        if (plan.durationFrames() > 500) {
            warnings.add("Long animation (" + plan.durationFrames() + " frames) may take time to bake");
        }
        int total = plan.totalObjectCount();
        if (total > 500) {
            warnings.add("High object count (" + total + ") may cause performance issues");
        }
        Integer resolution = plan.physics().resolutionMax();
        if (plan.simulationType().isFluid() && resolution != null && resolution > 256) {
            warnings.add("High fluid resolution (" + resolution + ") will be slow to bake");
        }
        return warnings;
    }

    /** The plan in the planning tool's input shape, used to show a previous plan during refinement. */
    public static ObjectNode toToolInput(Plan plan) {
        JsonNodeFactory f = JsonNodeFactory.instance;
        ObjectNode root = f.objectNode();
        root.put("simulation_type", plan.simulationType().wireValue());

        ArrayNode objects = root.putArray("objects");
        for (EntityDescriptor e : plan.entities()) {
            objects.addObject()
                    .put("name", e.name())
                    .put("object_type", e.shape().wireValue())
                    .put("count", e.count())
                    .put("material", e.material())
                    .put("scale", e.scale())
                    .put("is_static", e.isStatic());
        }
        root.put("duration_frames", plan.durationFrames());

        PhysicsSettings p = plan.physics();
        ObjectNode physics = root.putObject("physics_settings")
                .put("gravity", p.gravity())
                .put("substeps_per_frame", p.substepsPerFrame())
                .put("solver_iterations", p.solverIterations())
                .put("time_scale", p.timeScale());
        if (p.resolutionMax() != null) {
            physics.put("resolution_max", p.resolutionMax());
        }
        return root;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static EntityDescriptor parseEntity(JsonNode node, int index) {
        if (node == null || !node.isObject()) {
            throw invalid("objects[" + index + "] must be an object");
        }
        String name = requiredName(node, "name", index);
        String shapeValue = requiredText(node, "object_type");
        ShapeType shape = ShapeType.fromWire(shapeValue)
                .orElseThrow(() -> invalid("objects[" + index + "] has unknown object_type '" + shapeValue + "'"));
        int count = requiredInt(node, "count");
        if (count < 1 || count > EntityDescriptor.MAX_COUNT) {
            throw invalid("objects[" + index + "] count must be 1.." + EntityDescriptor.MAX_COUNT + ", got " + count);
        }
        String material = node.has("material") ? requiredName(node, "material", index) : "default";
        double scale = node.has("scale") ? requiredNumber(node, "scale") : 1.0;
        if (scale < MIN_SCALE || scale > MAX_SCALE) {
            throw invalid("objects[" + index + "] scale must be " + MIN_SCALE + ".." + MAX_SCALE + ", got " + scale);
        }
        boolean isStatic = node.path("is_static").asBoolean(false);
        return new EntityDescriptor(name, shape, count, material, scale, isStatic);
    }

    private static PhysicsSettings parsePhysics(JsonNode node, SimulationType type) {
        if (node.isMissingNode() || node.isNull()) {
            return PhysicsSettings.defaults();
        }
        if (!node.isObject()) {
            throw invalid("'physics_settings' must be an object");
        }
        double gravity = node.has("gravity") ? requiredNumber(node, "gravity") : PhysicsSettings.DEFAULT_GRAVITY;
        if (gravity > 0) {
            throw invalid("gravity must not be positive, got " + gravity);
        }
        int substeps = node.has("substeps_per_frame")
                ? requiredInt(node, "substeps_per_frame") : PhysicsSettings.DEFAULT_SUBSTEPS;
        int iterations = node.has("solver_iterations")
                ? requiredInt(node, "solver_iterations") : PhysicsSettings.DEFAULT_SOLVER_ITERATIONS;
        if (substeps < 1 || iterations < 1) {
            throw invalid("substeps_per_frame and solver_iterations must be positive");
        }
        double timeScale = node.has("time_scale") ? requiredNumber(node, "time_scale") : 1.0;
        if (timeScale <= 0) {
            throw invalid("time_scale must be positive, got " + timeScale);
        }

        Integer resolution = null;
        if (type.isFluid() && node.has("resolution_max")) {
            resolution = requiredInt(node, "resolution_max");
            if (resolution < MIN_RESOLUTION || resolution > MAX_RESOLUTION) {
                throw invalid("resolution_max must be " + MIN_RESOLUTION + ".." + MAX_RESOLUTION
                        + ", got " + resolution);
            }
        }
        return new PhysicsSettings(gravity, substeps, iterations, timeScale, resolution);
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw invalid("'" + field + "' must be a non-empty string");
        }
        return value.asText();
    }

    private static String requiredName(JsonNode node, String field, int index) {
        String value = requiredText(node, field);
        if (!NAME_PATTERN.matcher(value).matches()) {
            throw invalid("objects[" + index + "] " + field + " must be 1-64 letters, digits, '_', '-' or spaces, got '"
                    + value + "'");
        }
        return value;
    }

    private static int requiredInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToInt() || !value.isIntegralNumber()) {
            throw invalid("'" + field + "' must be an integer");
        }
        return value.intValue();
    }

    private static double requiredNumber(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw invalid("'" + field + "' must be a number");
        }
        return value.doubleValue();
    }

    private static StageException invalid(String detail) {
        return new StageException(FailureKind.PLANNING_FAILURE, "Invalid plan structure: " + detail);
    }
}
