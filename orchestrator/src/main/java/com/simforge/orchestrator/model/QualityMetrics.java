package com.simforge.orchestrator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Quality assessment of one executed attempt.
 *
 * @param score          0..1, a deterministic function of {@code checks}
 * @param checks         named sub-checks in evaluation order
 * @param issues         human-readable problems, in evaluation order
 * @param checkerVersion version of the scoring rules that produced this value
 */
public record QualityMetrics(
        double               score,
        Map<String, Boolean> checks,
        List<String>         issues,
        String               checkerVersion
) {
    public QualityMetrics {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be within 0..1, got " + score);
        }
        checks = Collections.unmodifiableMap(new LinkedHashMap<>(checks));
        issues = List.copyOf(issues);
    }

    public boolean meets(double threshold) {
        return score >= threshold;
    }
}
