package com.simforge.orchestrator.model;

/**
 * Result of resolving a material reference.
 *
 * @param requested the reference as it appeared in the plan
 * @param kind      how the properties were found
 */
public record MaterialMatch(String requested, MaterialProperties properties, Kind kind) {

    public enum Kind { EXACT, FUZZY, FALLBACK }
}
