package com.simforge.orchestrator.model;

/** An entity descriptor together with its resolved material. */
public record EnrichedEntity(EntityDescriptor descriptor, MaterialMatch material) {

    public EnrichedEntity {
        if (descriptor == null || material == null) {
            throw new IllegalArgumentException("descriptor and material are required");
        }
    }

    public MaterialProperties properties() {
        return material.properties();
    }
}
