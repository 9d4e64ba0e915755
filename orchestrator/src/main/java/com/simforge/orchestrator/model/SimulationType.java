package com.simforge.orchestrator.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kind of physics simulation a plan describes.
 * The wire value is the lower-case name used in the planning tool schema.
 */
public enum SimulationType {
    RIGID_BODY,
    FLUID_SMOKE,
    FLUID_FIRE,
    FLUID_LIQUID,
    CLOTH,
    SOFT_BODY;

    public String wireValue() {
        return name().toLowerCase();
    }

    public boolean isFluid() {
        return this == FLUID_SMOKE || this == FLUID_FIRE || this == FLUID_LIQUID;
    }

    public static Optional<SimulationType> fromWire(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(t -> t.wireValue().equals(value.trim().toLowerCase()))
                .findFirst();
    }
}
