package com.simforge.orchestrator.service;

import com.simforge.orchestrator.error.Classification;
import com.simforge.orchestrator.error.ErrorClassifier;
import com.simforge.orchestrator.model.StageName;
import com.simforge.orchestrator.stage.Stage;
import com.simforge.orchestrator.stage.StageContext;
import com.simforge.orchestrator.stage.StageResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;

/**
 * Runs one stage of one attempt with the retry loop around it.
 *
 * For every execution:
 *   1. Check the cancel flag, then run the stage.
 *   2. Check the cancel flag again; a result that arrives after cancellation is discarded.
 *   3. Add the elapsed time to the job's stage timings, and to the
 *      {@code simforge.stage.duration} timer tagged with stage and status.
 *
 * A failure is classified; if its kind still has attempt budget left the
 * runner backs off and re-enters the same stage, otherwise it throws
 * {@link StageFailedException}. An {@link Error} fails the stage at once.
 */
public class StageRunner {

    private static final Logger log = LoggerFactory.getLogger(StageRunner.class);

    static final String STAGE_TIMER = "simforge.stage.duration";

    private final ErrorClassifier classifier;
    private final RetryPolicy     retryPolicy;
    private final Sleeper         sleeper;
    private final MeterRegistry   meterRegistry;

    public StageRunner(ErrorClassifier classifier, RetryPolicy retryPolicy,
                       Sleeper sleeper, MeterRegistry meterRegistry) {
        this.classifier    = classifier;
        this.retryPolicy   = retryPolicy;
        this.sleeper       = sleeper;
        this.meterRegistry = meterRegistry;
    }

    public <I, O> O run(Stage<I, O> stage, I input, JobRun run, int iteration) {
        StageName name = stage.name();
        MDC.put("stage", name.key());
        try {
            for (int attempt = 1; ; attempt++) {
                StageContext ctx = new StageContext(run.job().getId(), attempt, iteration, run.progress());
                long start = System.nanoTime();
                try {
                    run.checkCancelled("before stage '" + name.key() + "'");
                    StageResult<O> result = stage.run(input, ctx);
                    run.checkCancelled("after stage '" + name.key() + "'");

                    record(run, iteration, name, result.elapsed(), "success");
                    return result.output();

                } catch (RuntimeException e) {
                    record(run, iteration, name, Duration.ofNanos(System.nanoTime() - start), "failure");
                    Classification c = classifier.classify(e);

                    if (!retryPolicy.shouldRetry(c.kind(), attempt)) {
                        log.error("Stage '{}' failed permanently (attempt {}/{}, kind={}): {}",
                                name.key(), attempt, retryPolicy.maxAttempts(c.kind()), c.kind(), c.message());
                        throw new StageFailedException(name, c, attempt, e);
                    }

                    Duration pause = retryPolicy.backoff(attempt);
                    log.warn("Stage '{}' failed (attempt {}/{}, kind={}), retrying in {} ms. Reason: {}",
                            name.key(), attempt, retryPolicy.maxAttempts(c.kind()), c.kind(),
                            pause.toMillis(), c.message());
                    pause(pause, name, attempt, e);

                } catch (Error e) {
                    // Errors are never retried.
                    record(run, iteration, name, Duration.ofNanos(System.nanoTime() - start), "failure");
                    if (PipelineOrchestrator.isFatal(e)) {
                        throw e;
                    }
                    Classification c = classifier.classify(e);
                    log.error("Stage '{}' raised {} (attempt {}): {}",
                            name.key(), e.getClass().getSimpleName(), attempt, c.message(), e);
                    throw new StageFailedException(name, c, attempt, e);
                }
            }
        } finally {
            MDC.remove("stage");
        }
    }

    private void pause(Duration pause, StageName name, int attempt, RuntimeException failure) {
        try {
            sleeper.sleep(pause);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            ie.addSuppressed(failure);
            throw new StageFailedException(name, classifier.classify(ie), attempt, ie);
        }
    }

    private void record(JobRun run, int iteration, StageName name, Duration elapsed, String status) {
        run.timings().record(iteration, name, elapsed);
        Timer.builder(STAGE_TIMER)
                .tag("stage", name.key())
                .tag("status", status)
                .register(meterRegistry)
                .record(elapsed);
    }
}
