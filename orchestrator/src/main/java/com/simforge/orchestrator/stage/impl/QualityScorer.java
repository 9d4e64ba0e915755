package com.simforge.orchestrator.stage.impl;

import com.simforge.orchestrator.model.Plan;
import com.simforge.orchestrator.model.QualityMetrics;
import com.simforge.orchestrator.model.SceneInspection;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic quality score for an inspected scene.
 *
 * Five weighted sub-checks; a failed check earns partial credit rather than
 * zero where the scene is still usable without it. The score only rises when a
 * check flips from failed to passed. Bump {@link #VERSION} whenever weights,
 * credits or tolerances change.
 */
public final class QualityScorer {

    public static final String VERSION = "quality-v1";

    public static final String OBJECT_COUNT_MATCH = "object_count_match";
    public static final String CAMERA_PRESENT     = "camera_present";
    public static final String LIGHTING_PRESENT   = "lighting_present";
    public static final String PHYSICS_CONFIGURED = "physics_configured";
    public static final String FRAME_RANGE_MATCH  = "frame_range_match";

    static final int OBJECT_COUNT_TOLERANCE = 2;
    static final int FRAME_RANGE_TOLERANCE  = 5;

    //                                   weight  credit when failed
    private static final double[][] RULES = {
            /* object_count_match */ {0.2, 0.5},
            /* camera_present     */ {0.2, 0.0},
            /* lighting_present   */ {0.1, 0.5},
            /* physics_configured */ {0.4, 0.0},
            /* frame_range_match  */ {0.1, 0.8},
    };

    private QualityScorer() {}

    public static QualityMetrics score(SceneInspection scene, Plan plan) {
        Map<String, Boolean> checks = new LinkedHashMap<>();
        List<String> issues = new ArrayList<>();

        int expectedObjects = plan.totalObjectCount();
        boolean countOk = Math.abs(scene.objectCount() - expectedObjects) <= OBJECT_COUNT_TOLERANCE;
        checks.put(OBJECT_COUNT_MATCH, countOk);
        if (!countOk) {
            issues.add("Object count mismatch: expected ~" + expectedObjects + ", got " + scene.objectCount());
        }

        checks.put(CAMERA_PRESENT, scene.hasCamera());
        if (!scene.hasCamera()) {
            issues.add("No camera found in scene");
        }

        boolean lit = scene.lightCount() > 0;
        checks.put(LIGHTING_PRESENT, lit);
        if (!lit) {
            issues.add("No lighting found in scene");
        }

        boolean physics = scene.physicsConfigured() && scene.physicsBodyCount() > 0;
        checks.put(PHYSICS_CONFIGURED, physics);
        if (!scene.physicsConfigured()) {
            issues.add(plan.simulationType().wireValue() + " physics not configured");
        } else if (scene.physicsBodyCount() == 0) {
            issues.add("No " + plan.simulationType().wireValue() + " physics bodies found");
        }

        boolean framesOk = Math.abs(scene.frameRange() - plan.durationFrames()) <= FRAME_RANGE_TOLERANCE;
        checks.put(FRAME_RANGE_MATCH, framesOk);
        if (!framesOk) {
            issues.add("Frame range mismatch: expected " + plan.durationFrames() + ", got " + scene.frameRange());
        }

        return new QualityMetrics(weigh(checks), checks, issues, VERSION);
    }

    private static double weigh(Map<String, Boolean> checks) {
        double score = 0.0;
        int i = 0;
        for (boolean passed : checks.values()) {
            double[] rule = RULES[i++];
            score += rule[0] * (passed ? 1.0 : rule[1]);
        }
        // Round away floating-point noise so equal inputs compare equal everywhere.
        return Math.min(1.0, Math.round(score * 1_000_000d) / 1_000_000d);
    }
}
