package com.simforge.orchestrator.service;

import com.simforge.orchestrator.model.Artifact;
import com.simforge.orchestrator.model.EnrichedPlan;
import com.simforge.orchestrator.model.ExecutionRecord;
import com.simforge.orchestrator.model.Plan;
import com.simforge.orchestrator.model.QualityMetrics;
import com.simforge.orchestrator.model.ValidatedArtifact;
import com.simforge.orchestrator.stage.ExecutionInput;
import com.simforge.orchestrator.stage.PlanningInput;
import com.simforge.orchestrator.stage.ScoringInput;
import com.simforge.orchestrator.stage.Stage;

/** The six stages of one attempt, in execution order. */
public record PipelineStages(
        Stage<PlanningInput, Plan>                 plan,
        Stage<Plan, EnrichedPlan>                  enrich,
        Stage<EnrichedPlan, Artifact>              generate,
        Stage<Artifact, ValidatedArtifact>         validate,
        Stage<ExecutionInput, ExecutionRecord>     execute,
        Stage<ScoringInput, QualityMetrics>        score
) {}
