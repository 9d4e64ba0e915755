package com.simforge.orchestrator.execution;

import com.simforge.orchestrator.model.Artifact;
import com.simforge.orchestrator.model.ExecutionRecord;

import java.time.Duration;

/**
 * Runs a generated artifact in the external environment.
 *
 * An abnormal run is reported through {@link ExecutionRecord#success()} with
 * the captured output, not by throwing. Implementations throw only when the
 * environment itself cannot be used or the run exceeds {@code timeout}.
 */
public interface ExecutionEnvironment {

    ExecutionRecord execute(Artifact artifact, Duration timeout);
}
