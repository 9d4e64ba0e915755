package com.simforge.orchestrator.model;

import java.util.List;

/**
 * Structured intent derived from a free-text request.
 *
 * Immutable: refinement replaces a Plan wholesale, and enrichment works on
 * copies made with the {@code with*} methods.
 */
public record Plan(
        SimulationType         simulationType,
        List<EntityDescriptor> entities,
        PhysicsSettings        physics,
        int                    durationFrames,
        int                    frameRate,
        String                 request
) {
    public static final int MAX_DURATION_FRAMES = 1000;
    public static final int DEFAULT_FRAME_RATE  = 24;

    public Plan {
        if (simulationType == null) {
            throw new IllegalArgumentException("simulationType is required");
        }
        entities = List.copyOf(entities);
        if (physics == null) {
            physics = PhysicsSettings.defaults();
        }
        if (durationFrames < 1 || durationFrames > MAX_DURATION_FRAMES) {
            throw new IllegalArgumentException(
                    "durationFrames must be 1.." + MAX_DURATION_FRAMES + ", got " + durationFrames);
        }
        if (frameRate <= 0) {
            frameRate = DEFAULT_FRAME_RATE;
        }
    }

    /** Total number of object instances across all entities. */
    public int totalObjectCount() {
        return entities.stream().mapToInt(EntityDescriptor::count).sum();
    }

    public Plan withPhysics(PhysicsSettings newPhysics) {
        return new Plan(simulationType, entities, newPhysics, durationFrames, frameRate, request);
    }

    public Plan withDurationFrames(int frames) {
        return new Plan(simulationType, entities, physics, frames, frameRate, request);
    }
}
