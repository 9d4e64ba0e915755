package com.simforge.orchestrator.model;

import java.util.List;

/**
 * Result of the structural and safety checks on an artifact.
 *
 * @param issues         blocking problems, in discovery order
 * @param autoFixApplied whether the checked script is the auto-fixed variant
 */
public record ValidationOutcome(boolean valid, List<String> issues, boolean autoFixApplied) {

    public ValidationOutcome {
        issues = List.copyOf(issues);
    }
}
