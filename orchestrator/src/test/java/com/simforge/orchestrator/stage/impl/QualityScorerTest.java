package com.simforge.orchestrator.stage.impl;

import com.simforge.orchestrator.Fixtures;
import com.simforge.orchestrator.model.Plan;
import com.simforge.orchestrator.model.QualityMetrics;
import com.simforge.orchestrator.model.SceneInspection;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class QualityScorerTest {

    private final Plan plan = Fixtures.rigidBodyPlan();   // 21 objects, 250 frames

    @Test
    void score_perfectScene_isOne() {
        QualityMetrics metrics = QualityScorer.score(new SceneInspection(21, true, 1, 250, true, 20), plan);

        assertThat(metrics.score()).isEqualTo(1.0);
        assertThat(metrics.issues()).isEmpty();
        assertThat(metrics.checks()).containsOnlyKeys(
                QualityScorer.OBJECT_COUNT_MATCH, QualityScorer.CAMERA_PRESENT, QualityScorer.LIGHTING_PRESENT,
                QualityScorer.PHYSICS_CONFIGURED, QualityScorer.FRAME_RANGE_MATCH);
        assertThat(metrics.checkerVersion()).isEqualTo(QualityScorer.VERSION);
    }

    @Test
    void score_withinTolerances_passes() {
        QualityMetrics metrics = QualityScorer.score(new SceneInspection(23, true, 2, 245, true, 20), plan);

        assertThat(metrics.score()).isEqualTo(1.0);
    }

    @Test
    void score_missingPhysics_losesFullWeight() {
        QualityMetrics metrics = QualityScorer.score(new SceneInspection(21, true, 1, 250, false, 0), plan);

        assertThat(metrics.score()).isCloseTo(0.6, within(1e-9));
        assertThat(metrics.checks().get(QualityScorer.PHYSICS_CONFIGURED)).isFalse();
        assertThat(metrics.issues()).containsExactly("rigid_body physics not configured");
    }

    @Test
    void score_physicsWorldWithoutBodies_fails() {
        QualityMetrics metrics = QualityScorer.score(new SceneInspection(21, true, 1, 250, true, 0), plan);

        assertThat(metrics.checks().get(QualityScorer.PHYSICS_CONFIGURED)).isFalse();
        assertThat(metrics.issues()).containsExactly("No rigid_body physics bodies found");
    }

    @Test
    void score_everythingWrong_keepsPartialCredit() {
        QualityMetrics metrics = QualityScorer.score(new SceneInspection(3, false, 0, 100, false, 0), plan);

        // 0.2*0.5 + 0 + 0.1*0.5 + 0 + 0.1*0.8
        assertThat(metrics.score()).isCloseTo(0.23, within(1e-9));
        assertThat(metrics.issues()).containsExactly(
                "Object count mismatch: expected ~21, got 3",
                "No camera found in scene",
                "No lighting found in scene",
                "rigid_body physics not configured",
                "Frame range mismatch: expected 250, got 100");
    }

    @Test
    void score_sameInputs_sameScore() {
        SceneInspection scene = new SceneInspection(10, true, 0, 240, true, 5);

        assertThat(QualityScorer.score(scene, plan)).isEqualTo(QualityScorer.score(scene, plan));
    }
}
