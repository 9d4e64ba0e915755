package com.simforge.orchestrator.model;

/**
 * Per-job options supplied by the caller.
 *
 * @param refinementEnabled       whether a below-threshold score may trigger re-planning
 * @param maxRefinementIterations upper bound on refinement iterations (0 = never refine)
 */
public record JobOptions(boolean refinementEnabled, int maxRefinementIterations) {

    public JobOptions {
        if (maxRefinementIterations < 0) {
            throw new IllegalArgumentException(
                    "maxRefinementIterations must be >= 0, got " + maxRefinementIterations);
        }
    }

    public static JobOptions withoutRefinement() {
        return new JobOptions(false, 0);
    }

    public static JobOptions refining(int maxIterations) {
        return new JobOptions(true, maxIterations);
    }

    /** Iterations the refinement loop may actually spend. */
    public int iterationBudget() {
        return refinementEnabled ? maxRefinementIterations : 0;
    }
}
