package com.simforge.orchestrator;

import com.simforge.orchestrator.model.Artifact;
import com.simforge.orchestrator.model.EnrichedEntity;
import com.simforge.orchestrator.model.EnrichedPlan;
import com.simforge.orchestrator.model.EntityDescriptor;
import com.simforge.orchestrator.model.ExecutionRecord;
import com.simforge.orchestrator.model.MaterialMatch;
import com.simforge.orchestrator.model.MaterialProperties;
import com.simforge.orchestrator.model.PhysicsSettings;
import com.simforge.orchestrator.model.Plan;
import com.simforge.orchestrator.model.QualityMetrics;
import com.simforge.orchestrator.model.SceneInspection;
import com.simforge.orchestrator.model.ScoredAttempt;
import com.simforge.orchestrator.model.ShapeType;
import com.simforge.orchestrator.model.SimulationType;
import com.simforge.orchestrator.model.ValidationOutcome;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Shared sample data for unit tests. */
public final class Fixtures {

    private Fixtures() {}

    public static final String REQUEST = "20 wooden blocks falling on a concrete floor";

    public static final MaterialProperties WOOD =
            new MaterialProperties("wood_pine", 500, 0.5, 0.3, 0.04, 0.1);
    public static final MaterialProperties CONCRETE =
            new MaterialProperties("concrete", 2400, 0.7, 0.1, 0.04, 0.1);
    public static final MaterialProperties DEFAULT =
            new MaterialProperties("default", 1000, 0.5, 0.3, 0.04, 0.1);

    public static Plan rigidBodyPlan() {
        return new Plan(SimulationType.RIGID_BODY,
                List.of(new EntityDescriptor("wooden_block", ShapeType.CUBE, 20, "wood", 1.0, false),
                        new EntityDescriptor("ground", ShapeType.PLANE, 1, "concrete", 1.0, true)),
                PhysicsSettings.defaults(), 250, 24, REQUEST);
    }

    public static EnrichedPlan enriched(Plan plan) {
        List<EnrichedEntity> entities = plan.entities().stream()
                .map(e -> new EnrichedEntity(e, new MaterialMatch(e.material(),
                        e.isStatic() ? CONCRETE : WOOD, MaterialMatch.Kind.FUZZY)))
                .toList();
        return new EnrichedPlan(plan, entities, List.of());
    }

    public static Artifact artifact() {
        return new Artifact("import bpy\nbpy.ops.wm.save_as_mainfile(filepath='/tmp/out.blend')\n",
                "scene_builder/rigid_body", 0.2, "/tmp/out.blend");
    }

    /** What the environment returns for a successful run; not inspected yet. */
    public static ExecutionRecord executed() {
        return executed("/tmp/out.blend");
    }

    public static ExecutionRecord executed(String outputRef) {
        return new ExecutionRecord(true, outputRef, Duration.ofSeconds(2), "ok", "", 0, null, null);
    }

    /** Scene matching {@link #rigidBodyPlan()} except that no rigid-body physics was set up. */
    public static SceneInspection sceneWithoutPhysics() {
        return new SceneInspection(21, true, 1, 250, false, 0);
    }

    public static QualityMetrics metrics(double score) {
        Map<String, Boolean> checks = new LinkedHashMap<>();
        checks.put("object_count_match", true);
        checks.put("camera_present", true);
        checks.put("lighting_present", true);
        checks.put("physics_configured", score >= 0.8);
        checks.put("frame_range_match", true);
        List<String> issues = score >= 0.8 ? List.of() : List.of("rigid_body physics not configured");
        return new QualityMetrics(score, checks, issues, "test");
    }

    public static ScoredAttempt attempt(int sequence, double score) {
        return attempt(sequence, score, executed());
    }

    public static ScoredAttempt attempt(int sequence, double score, ExecutionRecord execution) {
        Plan plan = rigidBodyPlan();
        return new ScoredAttempt(sequence, sequence, plan, enriched(plan), artifact(),
                new ValidationOutcome(true, List.of(), false), execution, metrics(score));
    }
}
