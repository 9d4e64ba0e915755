package com.simforge.orchestrator.stage.impl;

import com.simforge.orchestrator.error.FailureKind;
import com.simforge.orchestrator.error.StageException;
import com.simforge.orchestrator.materials.MaterialResolver;
import com.simforge.orchestrator.model.EnrichedEntity;
import com.simforge.orchestrator.model.EnrichedPlan;
import com.simforge.orchestrator.model.EntityDescriptor;
import com.simforge.orchestrator.model.MaterialMatch;
import com.simforge.orchestrator.model.MaterialProperties;
import com.simforge.orchestrator.model.PhysicsSettings;
import com.simforge.orchestrator.model.Plan;
import com.simforge.orchestrator.model.SimulationType;
import com.simforge.orchestrator.model.StageName;
import com.simforge.orchestrator.stage.Stage;
import com.simforge.orchestrator.stage.StageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Attaches physical material properties to every entity of a plan and applies
 * the per-simulation-type physics adjustments.
 *
 * Every descriptor gets exactly one enriched entity. A reference the catalog
 * cannot match uses the catalog's default material; only a missing default is
 * fatal.
 */
public class EnrichmentStage implements Stage<Plan, EnrichedPlan> {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentStage.class);

    static final int RIGID_BODY_MIN_FRAMES     = 100;
    static final int RIGID_BODY_DEFAULT_FRAMES = 250;
    static final int SMOKE_MAX_FRAMES          = 200;
    static final int SMOKE_DEFAULT_FRAMES      = 150;

    private final MaterialResolver materials;

    public EnrichmentStage(MaterialResolver materials) {
        this.materials = materials;
    }

    @Override
    public StageName name() {
        return StageName.ENRICH;
    }

    @Override
    public EnrichedPlan execute(Plan plan, StageContext ctx) {
        List<String> warnings = new ArrayList<>();
        Plan adjusted = adjustForSimulationType(plan, warnings);
        physicsWarnings(adjusted, warnings);

        List<EnrichedEntity> enriched = new ArrayList<>(adjusted.entities().size());
        Set<String> checkedMaterials = new LinkedHashSet<>();
        for (EntityDescriptor entity : adjusted.entities()) {
            MaterialMatch match = resolve(entity.material(), warnings);
            enriched.add(new EnrichedEntity(entity, match));
            if (checkedMaterials.add(match.properties().name())) {
                materialWarnings(match.properties(), warnings);
            }
            log.debug("Applied material '{}' to {} ({})",
                    match.properties().name(), entity.name(), match.kind());
        }

        log.info("Enriched {} entity group(s), {} warning(s)", enriched.size(), warnings.size());
        return new EnrichedPlan(adjusted, enriched, warnings);
    }

    private MaterialMatch resolve(String reference, List<String> warnings) {
        Optional<MaterialMatch> match = materials.resolve(reference);
        if (match.isPresent()) {
            return match.get();
        }
        MaterialProperties fallback = materials.fallback()
                .orElseThrow(() -> new StageException(FailureKind.ENRICHMENT_FAILURE,
                        "Unknown material '" + reference + "' and no default material is configured"));
        warnings.add("Unknown material '" + reference + "', using '" + fallback.name() + "'");
        return new MaterialMatch(reference, fallback, MaterialMatch.Kind.FALLBACK);
    }

    private static Plan adjustForSimulationType(Plan plan, List<String> warnings) {
        Plan adjusted = plan;
        SimulationType type = plan.simulationType();

        if (type.isFluid() && plan.physics().resolutionMax() == null) {
            adjusted = adjusted.withPhysics(
                    adjusted.physics().withResolutionMax(PhysicsSettings.DEFAULT_FLUID_RESOLUTION));
            log.info("Set default fluid resolution to {}", PhysicsSettings.DEFAULT_FLUID_RESOLUTION);
        }
        if (type == SimulationType.RIGID_BODY && plan.durationFrames() < RIGID_BODY_MIN_FRAMES) {
            adjusted = adjusted.withDurationFrames(RIGID_BODY_DEFAULT_FRAMES);
            warnings.add("Increased rigid body duration from " + plan.durationFrames()
                    + " to " + RIGID_BODY_DEFAULT_FRAMES + " frames");
        }
        if ((type == SimulationType.FLUID_SMOKE || type == SimulationType.FLUID_FIRE)
                && plan.durationFrames() > SMOKE_MAX_FRAMES) {
            adjusted = adjusted.withDurationFrames(SMOKE_DEFAULT_FRAMES);
            warnings.add("Reduced " + type.wireValue() + " duration from " + plan.durationFrames()
                    + " to " + SMOKE_DEFAULT_FRAMES + " frames");
        }
        return adjusted;
    }

    private static void physicsWarnings(Plan plan, List<String> warnings) {
        PhysicsSettings p = plan.physics();
        if (Math.abs(p.gravity()) > 50) {
            warnings.add("Very high gravity (" + p.gravity() + " m/s²) may cause instability");
        }
        if (plan.simulationType() == SimulationType.RIGID_BODY) {
            if (p.substepsPerFrame() < 5) {
                warnings.add("Low substeps (" + p.substepsPerFrame() + ") may cause instability");
            }
            if (p.solverIterations() < 5) {
                warnings.add("Low solver iterations (" + p.solverIterations() + ") may cause instability");
            }
        }
        if (plan.simulationType().isFluid() && p.resolutionMax() != null && p.resolutionMax() > 512) {
            warnings.add("Very high fluid resolution (" + p.resolutionMax() + ") will be very slow");
        }
    }

    private static void materialWarnings(MaterialProperties m, List<String> warnings) {
        if (m.density() < 10) {
            warnings.add("Material '" + m.name() + "': very low density (" + m.density() + " kg/m³)");
        } else if (m.density() > 20000) {
            warnings.add("Material '" + m.name() + "': very high density (" + m.density() + " kg/m³)");
        }
        if (m.friction() > 0.95) {
            warnings.add("Material '" + m.name() + "': extremely high friction (" + m.friction() + ")");
        }
        if (m.restitution() > 0.9) {
            warnings.add("Material '" + m.name() + "': very high restitution (" + m.restitution() + ")");
        }
        if (m.linearDamping() > 0.5) {
            warnings.add("Material '" + m.name() + "': high linear damping (" + m.linearDamping() + ")");
        }
    }
}
