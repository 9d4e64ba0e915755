package com.simforge.orchestrator.model;

/**
 * One group of identical objects in a plan.
 *
 * @param name     identifier used for the objects in the scene (e.g. "wooden_block")
 * @param shape    primitive mesh shape
 * @param count    number of instances, 1..1000
 * @param material material reference resolved during enrichment
 * @param scale    uniform scale multiplier
 * @param isStatic true for passive colliders such as a ground plane
 */
public record EntityDescriptor(
        String    name,
        ShapeType shape,
        int       count,
        String    material,
        double    scale,
        boolean   isStatic
) {
    public static final int MAX_COUNT = 1000;

    public EntityDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("entity name must not be blank");
        }
        if (shape == null) {
            throw new IllegalArgumentException("entity '" + name + "' has no shape");
        }
        if (count < 1 || count > MAX_COUNT) {
            throw new IllegalArgumentException(
                    "entity '" + name + "' count must be 1.." + MAX_COUNT + ", got " + count);
        }
        if (material == null || material.isBlank()) {
            material = "default";
        }
        if (scale <= 0) {
            throw new IllegalArgumentException("entity '" + name + "' scale must be positive");
        }
    }
}
