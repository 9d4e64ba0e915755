package com.simforge.orchestrator.stage;

import com.simforge.orchestrator.model.EnrichedPlan;
import com.simforge.orchestrator.model.ExecutionRecord;

/** Input of the quality stage: what was run and what it was supposed to produce. */
public record ScoringInput(ExecutionRecord execution, EnrichedPlan plan) {}
