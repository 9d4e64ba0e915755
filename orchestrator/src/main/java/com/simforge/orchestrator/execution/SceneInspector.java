package com.simforge.orchestrator.execution;

import com.simforge.orchestrator.model.EnrichedPlan;
import com.simforge.orchestrator.model.ExecutionRecord;
import com.simforge.orchestrator.model.SceneInspection;

import java.time.Duration;

/** Reads observable facts back from the scene an execution produced. */
public interface SceneInspector {

    SceneInspection inspect(ExecutionRecord execution, EnrichedPlan plan, Duration timeout);
}
