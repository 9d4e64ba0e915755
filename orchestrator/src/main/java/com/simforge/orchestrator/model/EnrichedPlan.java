package com.simforge.orchestrator.model;

import java.util.List;

/**
 * A plan in which every entity carries resolved material properties.
 *
 * The constructor enforces one enriched entity per descriptor, in order:
 * no entity may be dropped between planning and enrichment.
 */
public record EnrichedPlan(Plan plan, List<EnrichedEntity> entities, List<String> warnings) {

    public EnrichedPlan {
        entities = List.copyOf(entities);
        warnings = List.copyOf(warnings);
        if (entities.size() != plan.entities().size()) {
            throw new IllegalArgumentException("enriched " + entities.size()
                    + " of " + plan.entities().size() + " entities");
        }
        for (int i = 0; i < entities.size(); i++) {
            if (!entities.get(i).descriptor().equals(plan.entities().get(i))) {
                throw new IllegalArgumentException("enriched entity " + i + " does not match the plan");
            }
        }
    }
}
