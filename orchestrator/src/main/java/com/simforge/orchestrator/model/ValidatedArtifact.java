package com.simforge.orchestrator.model;

/** Output of the validation stage: the artifact that passed (possibly auto-fixed). */
public record ValidatedArtifact(Artifact artifact, ValidationOutcome outcome) {}
