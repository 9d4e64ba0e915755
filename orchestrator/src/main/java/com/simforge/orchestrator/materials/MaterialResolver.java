package com.simforge.orchestrator.materials;

import com.simforge.orchestrator.model.MaterialMatch;
import com.simforge.orchestrator.model.MaterialProperties;

import java.util.List;
import java.util.Optional;

/**
 * Looks up physical properties for the material references a plan uses.
 */
public interface MaterialResolver {

    /** @return the match for {@code reference}, empty if nothing in the catalog fits */
    Optional<MaterialMatch> resolve(String reference);

    /** The configured default material, empty if it is missing from the catalog. */
    Optional<MaterialProperties> fallback();

    /** Known material names, in catalog order. */
    List<String> names();
}
