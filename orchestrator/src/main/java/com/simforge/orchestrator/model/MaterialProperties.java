package com.simforge.orchestrator.model;

/**
 * Physical constants of one material.
 *
 * @param density        kg/m³
 * @param friction       0..1
 * @param restitution    bounciness, 0..1
 * @param linearDamping  0..1
 * @param angularDamping 0..1
 */
public record MaterialProperties(
        String name,
        double density,
        double friction,
        double restitution,
        double linearDamping,
        double angularDamping
) {
    public MaterialProperties {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("material name must not be blank");
        }
        if (density <= 0) {
            throw new IllegalArgumentException("material '" + name + "' density must be positive");
        }
        requireUnit(name, "friction", friction);
        requireUnit(name, "restitution", restitution);
        requireUnit(name, "linearDamping", linearDamping);
        requireUnit(name, "angularDamping", angularDamping);
    }

    private static void requireUnit(String material, String field, double value) {
        if (value < 0 || value > 1) {
            throw new IllegalArgumentException(
                    "material '" + material + "' " + field + " must be within 0..1, got " + value);
        }
    }
}
