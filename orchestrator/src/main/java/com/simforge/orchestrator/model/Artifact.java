package com.simforge.orchestrator.model;

/**
 * Generated scene script for one pipeline attempt.
 *
 * @param script      Blender Python source
 * @param templateKey which builder the script was assembled from
 * @param complexity  estimated cost of running the script, 0..1
 * @param outputRef   scene file the script writes
 */
public record Artifact(String script, String templateKey, double complexity, String outputRef) {

    public Artifact {
        if (script == null || script.isBlank()) {
            throw new IllegalArgumentException("artifact script must not be blank");
        }
    }

    public Artifact withScript(String newScript) {
        return new Artifact(newScript, templateKey, complexity, outputRef);
    }

    public int lineCount() {
        return (int) script.lines().count();
    }
}
