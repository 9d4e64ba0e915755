package com.simforge.orchestrator.stage.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.simforge.orchestrator.Fixtures;
import com.simforge.orchestrator.model.Artifact;
import com.simforge.orchestrator.model.EntityDescriptor;
import com.simforge.orchestrator.model.PhysicsSettings;
import com.simforge.orchestrator.model.Plan;
import com.simforge.orchestrator.model.ShapeType;
import com.simforge.orchestrator.model.SimulationType;
import com.simforge.orchestrator.progress.ProgressReporter;
import com.simforge.orchestrator.stage.StageContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ArtifactGenerationStageTest {

    @TempDir Path outputDir;

    @Test
    void execute_rendersValidScriptWithEmbeddedParameters() {
        UUID jobId = UUID.randomUUID();
        ArtifactGenerationStage stage = new ArtifactGenerationStage(outputDir, new ObjectMapper());

        Artifact artifact = stage.execute(Fixtures.enriched(Fixtures.rigidBodyPlan()),
                new StageContext(jobId, 1, 2, ProgressReporter.noop()));

        assertThat(artifact.script())
                .doesNotContain(ArtifactGenerationStage.PARAMS_PLACEHOLDER)
                .contains("wooden_block")
                .contains("wood_pine");
        assertThat(artifact.templateKey()).isEqualTo("scene_builder/rigid_body");
        assertThat(artifact.outputRef())
                .isEqualTo(outputDir.resolve("job-" + jobId + "-i2.blend").toAbsolutePath().toString());
        assertThat(ScriptValidator.validate(artifact.script(), false).valid()).isTrue();
    }

    @Test
    void execute_samePlanTwice_isDeterministic() {
        UUID jobId = UUID.randomUUID();
        ArtifactGenerationStage stage = new ArtifactGenerationStage(outputDir, new ObjectMapper());
        StageContext ctx = new StageContext(jobId, 1, 0, ProgressReporter.noop());

        Artifact first  = stage.execute(Fixtures.enriched(Fixtures.rigidBodyPlan()), ctx);
        Artifact second = stage.execute(Fixtures.enriched(Fixtures.rigidBodyPlan()), ctx);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void complexity_growsWithTypeSizeAndResolution() {
        assertThat(ArtifactGenerationStage.complexity(Fixtures.rigidBodyPlan())).isCloseTo(0.2, within(1e-9));

        Plan heavyFluid = new Plan(SimulationType.FLUID_LIQUID,
                List.of(new EntityDescriptor("drops", ShapeType.SPHERE, 120, "water", 1.0, false)),
                new PhysicsSettings(-9.81, 10, 10, 1.0, 256), 400, 24, "req");
        assertThat(ArtifactGenerationStage.complexity(heavyFluid)).isEqualTo(1.0);
    }
}
