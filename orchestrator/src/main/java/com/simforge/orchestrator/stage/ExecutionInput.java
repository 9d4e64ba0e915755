package com.simforge.orchestrator.stage;

import com.simforge.orchestrator.model.EnrichedPlan;
import com.simforge.orchestrator.model.ValidatedArtifact;

/** Input of the execution stage: the artifact to run and the plan its scene is inspected against. */
public record ExecutionInput(ValidatedArtifact validated, EnrichedPlan plan) {}
