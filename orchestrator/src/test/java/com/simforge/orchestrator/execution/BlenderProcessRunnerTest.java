package com.simforge.orchestrator.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.simforge.orchestrator.Fixtures;
import com.simforge.orchestrator.error.FailureKind;
import com.simforge.orchestrator.error.StageException;
import com.simforge.orchestrator.model.Artifact;
import com.simforge.orchestrator.model.ExecutionRecord;
import com.simforge.orchestrator.model.SceneInspection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BlenderProcessRunnerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void parseInspection_readsMarkedLineAmongBlenderNoise() {
        String stdout = """
                Blender 4.1.0 (hash abc)
                Read blend: /tmp/out.blend
                INSPECTION_RESULT: {"object_count": 21, "has_camera": true, "light_count": 1, "frame_range": 250, "physics_configured": true, "physics_body_count": 20, "extra": 1}
                Blender quit
                """;

        SceneInspection scene = BlenderProcessRunner.parseInspection(stdout, mapper);

        assertThat(scene).isEqualTo(new SceneInspection(21, true, 1, 250, true, 20));
    }

    @Test
    void parseInspection_noMarker_isExecutionFailure() {
        assertThatThrownBy(() -> BlenderProcessRunner.parseInspection("Blender quit\n", mapper))
                .isInstanceOf(StageException.class)
                .extracting(e -> ((StageException) e).getKind())
                .isEqualTo(FailureKind.EXECUTION_FAILURE);
    }

    @Test
    void parseInspection_malformedJson_isExecutionFailure() {
        assertThatThrownBy(() -> BlenderProcessRunner.parseInspection("INSPECTION_RESULT: {oops\n", mapper))
                .isInstanceOf(StageException.class)
                .hasMessageStartingWith("Malformed inspection result");
    }

    @Test
    void inspect_failedExecution_isExecutionFailureWithoutRunningBlender() {
        BlenderProcessRunner runner = new BlenderProcessRunner("/nonexistent/blender", mapper);
        ExecutionRecord failed = ExecutionRecord.failed("crashed", "", "segfault", 139, Duration.ofSeconds(1));

        assertThatThrownBy(() -> runner.inspect(failed, Fixtures.enriched(Fixtures.rigidBodyPlan()),
                Duration.ofSeconds(5)))
                .isInstanceOf(StageException.class)
                .extracting(e -> ((StageException) e).getKind())
                .isEqualTo(FailureKind.EXECUTION_FAILURE);
    }

    @Test
    void execute_missingExecutable_isExecutionFailure(@TempDir Path outputDir) {
        BlenderProcessRunner runner = new BlenderProcessRunner("/nonexistent/blender", mapper);
        Artifact artifact = new Artifact(Fixtures.artifact().script(), "scene_builder/rigid_body", 0.2,
                outputDir.resolve("scene.blend").toString());

        assertThatThrownBy(() -> runner.execute(artifact, Duration.ofSeconds(5)))
                .isInstanceOf(StageException.class)
                .extracting(e -> ((StageException) e).getKind())
                .isEqualTo(FailureKind.EXECUTION_FAILURE);
    }
}
