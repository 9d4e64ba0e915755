package com.simforge.orchestrator.stage;

import com.simforge.orchestrator.error.StageException;
import com.simforge.orchestrator.model.StageName;

import java.time.Duration;

/**
 * One step of the simulation pipeline.
 *
 * <p>Contract:
 * <ul>
 *   <li>{@link #execute} must not mutate its input; all stage boundary types
 *       are immutable records.</li>
 *   <li>A stage never retries. It raises a {@link StageException} (or lets an
 *       unexpected exception escape) and the orchestrator decides.</li>
 *   <li>A stage may emit progress through {@link StageContext#progress()}.</li>
 * </ul>
 *
 * @param <I> input type
 * @param <O> output type
 */
public interface Stage<I, O> {

    StageName name();

    O execute(I input, StageContext ctx) throws StageException;

    /**
     * Execute and report the wall-clock time the execution took.
     * Failures propagate unchanged.
     */
    default StageResult<O> run(I input, StageContext ctx) {
        long start = System.nanoTime();
        O output = execute(input, ctx);
        return new StageResult<>(output, Duration.ofNanos(System.nanoTime() - start));
    }
}
