package com.simforge.orchestrator.materials;

import com.simforge.orchestrator.model.MaterialMatch;
import com.simforge.orchestrator.model.MaterialProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory material table loaded from configuration.
 *
 * Lookup order: exact name, then the normalized name (lower case, spaces to
 * underscores), then the first catalog entry whose name contains the reference
 * or is contained by it, so "wood" finds "wood_pine" and "oak wood table" finds
 * "wood". Fuzzy matching walks entries in catalog order and is therefore
 * deterministic.
 */
public class MaterialCatalog implements MaterialResolver {

    private static final Logger log = LoggerFactory.getLogger(MaterialCatalog.class);

    private final Map<String, MaterialProperties> materials;
    private final String                          defaultName;

    public MaterialCatalog(Map<String, MaterialProperties> materials, String defaultName) {
        this.materials   = Collections.unmodifiableMap(new LinkedHashMap<>(materials));
        this.defaultName = defaultName;
    }

    @Override
    public Optional<MaterialMatch> resolve(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        MaterialProperties exact = materials.get(reference);
        if (exact != null) {
            return Optional.of(new MaterialMatch(reference, exact, MaterialMatch.Kind.EXACT));
        }

        String normalized = normalize(reference);
        MaterialProperties byNormalized = materials.get(normalized);
        if (byNormalized != null) {
            return Optional.of(new MaterialMatch(reference, byNormalized, MaterialMatch.Kind.EXACT));
        }

        for (Map.Entry<String, MaterialProperties> entry : materials.entrySet()) {
            String key = entry.getKey();
            if (key.equals(defaultName)) continue;
            if (key.contains(normalized) || normalized.contains(key)) {
                log.debug("Fuzzy matched material '{}' to '{}'", reference, key);
                return Optional.of(new MaterialMatch(reference, entry.getValue(), MaterialMatch.Kind.FUZZY));
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<MaterialProperties> fallback() {
        return Optional.ofNullable(defaultName).map(materials::get);
    }

    @Override
    public List<String> names() {
        return List.copyOf(materials.keySet());
    }

    static String normalize(String reference) {
        return reference.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
