package com.simforge.orchestrator.stage.impl;

import com.simforge.orchestrator.Fixtures;
import com.simforge.orchestrator.error.FailureKind;
import com.simforge.orchestrator.error.StageException;
import com.simforge.orchestrator.materials.MaterialCatalog;
import com.simforge.orchestrator.model.EnrichedPlan;
import com.simforge.orchestrator.model.EntityDescriptor;
import com.simforge.orchestrator.model.MaterialMatch;
import com.simforge.orchestrator.model.MaterialProperties;
import com.simforge.orchestrator.model.PhysicsSettings;
import com.simforge.orchestrator.model.Plan;
import com.simforge.orchestrator.model.ShapeType;
import com.simforge.orchestrator.model.SimulationType;
import com.simforge.orchestrator.progress.ProgressReporter;
import com.simforge.orchestrator.stage.StageContext;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnrichmentStageTest {

    private static final StageContext CTX = new StageContext(UUID.randomUUID(), 1, 0, ProgressReporter.noop());

    private static MaterialCatalog catalog(boolean withDefault) {
        Map<String, MaterialProperties> materials = new LinkedHashMap<>();
        materials.put("wood_pine", Fixtures.WOOD);
        materials.put("concrete", Fixtures.CONCRETE);
        materials.put("rubber", new MaterialProperties("rubber", 1100, 0.9, 0.95, 0.1, 0.1));
        if (withDefault) {
            materials.put("default", Fixtures.DEFAULT);
        }
        return new MaterialCatalog(materials, "default");
    }

    private static Plan plan(SimulationType type, int frames, EntityDescriptor... entities) {
        return new Plan(type, List.of(entities), PhysicsSettings.defaults(), frames, 24, "req");
    }

    @Test
    void execute_resolvesEveryEntityInOrder() {
        EnrichedPlan enriched = new EnrichmentStage(catalog(true)).execute(Fixtures.rigidBodyPlan(), CTX);

        assertThat(enriched.entities()).hasSize(2);
        assertThat(enriched.entities().get(0).properties().name()).isEqualTo("wood_pine");
        assertThat(enriched.entities().get(0).material().kind()).isEqualTo(MaterialMatch.Kind.FUZZY);
        assertThat(enriched.entities().get(1).material().kind()).isEqualTo(MaterialMatch.Kind.EXACT);
        assertThat(enriched.warnings()).isEmpty();
    }

    @Test
    void execute_unknownMaterial_usesDefaultWithWarning() {
        Plan plan = plan(SimulationType.CLOTH, 120,
                new EntityDescriptor("flag", ShapeType.PLANE, 1, "unobtainium", 1.0, false));

        EnrichedPlan enriched = new EnrichmentStage(catalog(true)).execute(plan, CTX);

        assertThat(enriched.entities().get(0).material().kind()).isEqualTo(MaterialMatch.Kind.FALLBACK);
        assertThat(enriched.entities().get(0).properties()).isEqualTo(Fixtures.DEFAULT);
        assertThat(enriched.warnings()).contains("Unknown material 'unobtainium', using 'default'");
    }

    @Test
    void execute_unknownMaterialWithoutDefault_isEnrichmentFailure() {
        Plan plan = plan(SimulationType.CLOTH, 120,
                new EntityDescriptor("flag", ShapeType.PLANE, 1, "unobtainium", 1.0, false));

        assertThatThrownBy(() -> new EnrichmentStage(catalog(false)).execute(plan, CTX))
                .isInstanceOf(StageException.class)
                .extracting(e -> ((StageException) e).getKind())
                .isEqualTo(FailureKind.ENRICHMENT_FAILURE);
    }

    @Test
    void execute_shortRigidBody_isExtendedWithWarning() {
        Plan plan = plan(SimulationType.RIGID_BODY, 48,
                new EntityDescriptor("ground", ShapeType.PLANE, 1, "concrete", 1.0, true));

        EnrichedPlan enriched = new EnrichmentStage(catalog(true)).execute(plan, CTX);

        assertThat(enriched.plan().durationFrames()).isEqualTo(250);
        assertThat(enriched.warnings()).contains("Increased rigid body duration from 48 to 250 frames");
    }

    @Test
    void execute_longSmoke_isShortenedAndFluidGetsDefaultResolution() {
        Plan plan = plan(SimulationType.FLUID_SMOKE, 400,
                new EntityDescriptor("emitter", ShapeType.SPHERE, 1, "default", 1.0, false));

        EnrichedPlan enriched = new EnrichmentStage(catalog(true)).execute(plan, CTX);

        assertThat(enriched.plan().durationFrames()).isEqualTo(150);
        assertThat(enriched.plan().physics().resolutionMax()).isEqualTo(128);
        assertThat(enriched.warnings()).contains("Reduced fluid_smoke duration from 400 to 150 frames");
    }

    @Test
    void execute_extremeMaterial_warnsOncePerMaterial() {
        Plan plan = plan(SimulationType.RIGID_BODY, 250,
                new EntityDescriptor("ball", ShapeType.SPHERE, 5, "rubber", 1.0, false),
                new EntityDescriptor("other_ball", ShapeType.SPHERE, 5, "rubber", 1.0, false),
                new EntityDescriptor("ground", ShapeType.PLANE, 1, "concrete", 1.0, true));

        EnrichedPlan enriched = new EnrichmentStage(catalog(true)).execute(plan, CTX);

        assertThat(enriched.warnings())
                .filteredOn(w -> w.startsWith("Material 'rubber'"))
                .containsExactly("Material 'rubber': very high restitution (0.95)");
    }

    @Test
    void execute_lowSubsteps_warns() {
        Plan plan = new Plan(SimulationType.RIGID_BODY,
                List.of(new EntityDescriptor("ground", ShapeType.PLANE, 1, "concrete", 1.0, true)),
                new PhysicsSettings(-9.81, 2, 10, 1.0, null), 250, 24, "req");

        EnrichedPlan enriched = new EnrichmentStage(catalog(true)).execute(plan, CTX);

        assertThat(enriched.warnings()).containsExactly("Low substeps (2) may cause instability");
    }

    @Test
    void execute_strongDownwardGravity_warnsWithoutFailing() {
        Plan plan = new Plan(SimulationType.RIGID_BODY,
                List.of(new EntityDescriptor("ground", ShapeType.PLANE, 1, "concrete", 1.0, true)),
                new PhysicsSettings(-80.0, 10, 10, 1.0, null), 250, 24, "req");

        EnrichedPlan enriched = new EnrichmentStage(catalog(true)).execute(plan, CTX);

        assertThat(enriched.plan().physics().gravity()).isEqualTo(-80.0);
        assertThat(enriched.warnings()).containsExactly("Very high gravity (-80.0 m/s²) may cause instability");
    }
}
