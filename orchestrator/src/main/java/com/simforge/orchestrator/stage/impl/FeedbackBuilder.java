package com.simforge.orchestrator.stage.impl;

import com.simforge.orchestrator.model.QualityMetrics;

import java.util.Locale;
import java.util.Map;

/**
 * Turns quality metrics into the feedback text used for re-planning.
 * Deterministic: the same metrics always produce the same text.
 */
public final class FeedbackBuilder {

    private FeedbackBuilder() {}

    public static String build(QualityMetrics metrics, double threshold) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "Quality score %.2f is below the required %.2f.\n", metrics.score(), threshold));

        sb.append("Failed checks:");
        boolean anyFailed = false;
        for (Map.Entry<String, Boolean> check : metrics.checks().entrySet()) {
            if (!check.getValue()) {
                sb.append('\n').append("- ").append(check.getKey());
                anyFailed = true;
            }
        }
        if (!anyFailed) {
            sb.append(" none");
        }

        sb.append('\n').append("Issues:");
        if (metrics.issues().isEmpty()) {
            sb.append(" none");
        }
        for (String issue : metrics.issues()) {
            sb.append('\n').append("- ").append(issue);
        }
        return sb.toString();
    }
}
