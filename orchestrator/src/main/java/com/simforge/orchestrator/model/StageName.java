package com.simforge.orchestrator.model;

/**
 * The six pipeline stages, in execution order.
 *
 * Each stage has a fixed progress checkpoint reported when the orchestrator
 * enters it, so callers see non-decreasing progress within one attempt.
 */
public enum StageName {
    PLAN              ("plan",     0.10, "Planning simulation"),
    ENRICH            ("enrich",   0.25, "Resolving material properties"),
    GENERATE_ARTIFACT ("generate", 0.40, "Generating scene script"),
    VALIDATE_ARTIFACT ("validate", 0.55, "Validating scene script"),
    EXECUTE           ("execute",  0.70, "Executing in Blender"),
    SCORE_QUALITY     ("score",    0.90, "Scoring quality");

    private final String key;
    private final double checkpoint;
    private final String label;

    StageName(String key, double checkpoint, String label) {
        this.key        = key;
        this.checkpoint = checkpoint;
        this.label      = label;
    }

    /** Short stable identifier used in timing maps, metrics and logs. */
    public String key()        { return key; }
    public double checkpoint() { return checkpoint; }
    public String label()      { return label; }
}
