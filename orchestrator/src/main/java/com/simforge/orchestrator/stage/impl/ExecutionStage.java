package com.simforge.orchestrator.stage.impl;

import com.simforge.orchestrator.error.FailureKind;
import com.simforge.orchestrator.error.StageException;
import com.simforge.orchestrator.execution.ExecutionEnvironment;
import com.simforge.orchestrator.execution.ExecutionLimiter;
import com.simforge.orchestrator.execution.SceneInspector;
import com.simforge.orchestrator.model.ExecutionRecord;
import com.simforge.orchestrator.model.SceneInspection;
import com.simforge.orchestrator.model.StageName;
import com.simforge.orchestrator.stage.CallDeadline;
import com.simforge.orchestrator.stage.ExecutionInput;
import com.simforge.orchestrator.stage.Stage;
import com.simforge.orchestrator.stage.StageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Runs a validated artifact in the external environment, then reads the
 * produced scene back with the {@link SceneInspector}.
 *
 * Both calls go to the environment, so both run under one
 * {@link ExecutionLimiter} permit. Each call holds its own reference to the
 * permit: a call abandoned at its deadline or on cancellation keeps the slot
 * until it has really finished. An unsuccessful run becomes an
 * EXECUTION_FAILURE carrying the captured output as diagnostics.
 */
public class ExecutionStage implements Stage<ExecutionInput, ExecutionRecord> {

    private static final Logger log = LoggerFactory.getLogger(ExecutionStage.class);

    private final ExecutionEnvironment environment;
    private final SceneInspector       inspector;
    private final ExecutionLimiter     limiter;
    private final CallDeadline         deadline;
    private final Duration             executionTimeout;
    private final Duration             inspectionTimeout;

    public ExecutionStage(ExecutionEnvironment environment, SceneInspector inspector,
                          ExecutionLimiter limiter, CallDeadline deadline,
                          Duration executionTimeout, Duration inspectionTimeout) {
        this.environment       = environment;
        this.inspector         = inspector;
        this.limiter           = limiter;
        this.deadline          = deadline;
        this.executionTimeout  = executionTimeout;
        this.inspectionTimeout = inspectionTimeout;
    }

    @Override
    public StageName name() {
        return StageName.EXECUTE;
    }

    @Override
    public ExecutionRecord execute(ExecutionInput input, StageContext ctx) {
        ExecutionLimiter.Permit permit;
        try {
            permit = limiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageException(FailureKind.CANCELLED, "Interrupted while waiting for an execution slot", e);
        }
        try (permit) {
            log.debug("Execution slot acquired ({}/{} held)", limiter.heldCount(), limiter.capacity());
            ExecutionRecord record = deadline.call("Execution", executionTimeout,
                    () -> environment.execute(input.validated().artifact(), executionTimeout),
                    permit.share());
            if (!record.success()) {
                throw new StageException(FailureKind.EXECUTION_FAILURE,
                        "Execution failed: " + record.failureDetail(), record.diagnostics(), null);
            }
            SceneInspection scene = deadline.call("Scene inspection", inspectionTimeout,
                    () -> inspector.inspect(record, input.plan(), inspectionTimeout),
                    permit.share());
            return record.withInspection(scene);
        }
    }
}
