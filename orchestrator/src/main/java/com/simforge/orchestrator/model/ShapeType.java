package com.simforge.orchestrator.model;

import java.util.Arrays;
import java.util.Optional;

/** Primitive mesh shape of an entity. */
public enum ShapeType {
    CUBE,
    SPHERE,
    CYLINDER,
    CONE,
    PLANE,
    TORUS,
    MONKEY;

    public String wireValue() {
        return name().toLowerCase();
    }

    public static Optional<ShapeType> fromWire(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(t -> t.wireValue().equals(value.trim().toLowerCase()))
                .findFirst();
    }
}
