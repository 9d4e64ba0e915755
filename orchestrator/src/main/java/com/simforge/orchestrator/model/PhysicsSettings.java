package com.simforge.orchestrator.model;

/**
 * Global physics parameters of a plan.
 *
 * @param gravity          m/s², negative pulls down
 * @param substepsPerFrame rigid-body solver substeps
 * @param solverIterations rigid-body solver iterations
 * @param timeScale        simulation speed multiplier
 * @param resolutionMax    fluid domain resolution; null for non-fluid plans
 */
public record PhysicsSettings(
        double  gravity,
        int     substepsPerFrame,
        int     solverIterations,
        double  timeScale,
        Integer resolutionMax
) {
    public static final double  DEFAULT_GRAVITY          = -9.81;
    public static final int     DEFAULT_SUBSTEPS         = 10;
    public static final int     DEFAULT_SOLVER_ITERATIONS = 10;
    public static final int     DEFAULT_FLUID_RESOLUTION = 128;

    public static PhysicsSettings defaults() {
        return new PhysicsSettings(DEFAULT_GRAVITY, DEFAULT_SUBSTEPS, DEFAULT_SOLVER_ITERATIONS, 1.0, null);
    }

    public PhysicsSettings withResolutionMax(Integer resolution) {
        return new PhysicsSettings(gravity, substepsPerFrame, solverIterations, timeScale, resolution);
    }
}
