package com.simforge.orchestrator.service;

import com.simforge.orchestrator.error.Classification;
import com.simforge.orchestrator.error.ErrorClassifier;
import com.simforge.orchestrator.model.Artifact;
import com.simforge.orchestrator.model.EnrichedPlan;
import com.simforge.orchestrator.model.ExecutionRecord;
import com.simforge.orchestrator.model.Job;
import com.simforge.orchestrator.model.JobError;
import com.simforge.orchestrator.model.JobOptions;
import com.simforge.orchestrator.model.JobResult;
import com.simforge.orchestrator.model.JobState;
import com.simforge.orchestrator.model.Outcome;
import com.simforge.orchestrator.model.Plan;
import com.simforge.orchestrator.model.QualityMetrics;
import com.simforge.orchestrator.model.ScoredAttempt;
import com.simforge.orchestrator.model.StageName;
import com.simforge.orchestrator.model.ValidatedArtifact;
import com.simforge.orchestrator.progress.ProgressListener;
import com.simforge.orchestrator.stage.ExecutionInput;
import com.simforge.orchestrator.stage.PlanningInput;
import com.simforge.orchestrator.stage.ScoringInput;
import com.simforge.orchestrator.stage.Stage;
import com.simforge.orchestrator.stage.impl.PlanParser;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Drives one job from request to {@link JobResult}.
 *
 * An attempt runs the six stages in fixed order:
 * <pre>
 *   plan → enrich → generate → validate → execute → score
 * </pre>
 * Each stage goes through {@link StageRunner} (retry, timing, cancellation)
 * and reports its checkpoint fraction before it starts. The
 * {@link RefinementLoop} decides whether another attempt is needed.
 *
 * {@link #runJob(Job)} always returns a result: failures, including
 * {@link Error}s raised by a stage, become a FAILED result with a classified
 * error, and the best attempt scored so far is kept. A fatal
 * {@link VirtualMachineError} is rethrown once that result is published.
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final String OUTCOME_COUNTER = "simforge.job.outcomes";

    private final PipelineStages  stages;
    private final StageRunner     runner;
    private final RefinementLoop  refinement;
    private final ErrorClassifier classifier;
    private final MeterRegistry   meterRegistry;

    public PipelineOrchestrator(PipelineStages stages,
                                StageRunner runner,
                                RefinementLoop refinement,
                                ErrorClassifier classifier,
                                MeterRegistry meterRegistry) {
        this.stages        = stages;
        this.runner        = runner;
        this.refinement    = refinement;
        this.classifier    = classifier;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    public JobResult runJob(String request, JobOptions options) {
        return runJob(request, options, null);
    }

    public JobResult runJob(String request, JobOptions options, ProgressListener listener) {
        return runJob(new Job(request, options, listener));
    }

    /**
     * Run the job to completion on the calling thread.
     *
     * The job's state is RUNNING (REFINING during refinement iterations) until
     * the terminal result is published on it.
     */
    public JobResult runJob(Job job) {
        MDC.put("jobId", job.getId().toString());
        JobRun run = new JobRun(job);
        try {
            log.info("Starting job {}: '{}'", job.getId(), abbreviate(job.getRequest()));
            job.setState(JobState.RUNNING);

            Outcome outcome = refinement.run(run, this::runAttempt);

            run.progress().report("complete", 1.0, "Complete");
            return finish(run, success(run, outcome));

        } catch (Throwable t) {
            JobResult result = finish(run, failure(run, t));
            if (isFatal(t)) {
                throw (VirtualMachineError) t;
            }
            return result;
        } finally {
            MDC.clear();
        }
    }

    // ------------------------------------------------------------------
    // One attempt
    // ------------------------------------------------------------------

    private ScoredAttempt runAttempt(JobRun run, PlanningInput input, int iteration) {
        run.progress().beginAttempt();

        Plan plan = runStage(stages.plan(), input, run, iteration);
        run.warnAll(PlanParser.sanityWarnings(plan));

        EnrichedPlan enriched = runStage(stages.enrich(), plan, run, iteration);
        run.warnAll(enriched.warnings());

        Artifact artifact = runStage(stages.generate(), enriched, run, iteration);
        ValidatedArtifact validated = runStage(stages.validate(), artifact, run, iteration);
        ExecutionRecord execution = runStage(stages.execute(), new ExecutionInput(validated, enriched), run, iteration);
        QualityMetrics metrics = runStage(stages.score(), new ScoringInput(execution, enriched), run, iteration);

        return new ScoredAttempt(run.nextSequence(), iteration, enriched.plan(), enriched,
                validated.artifact(), validated.outcome(), execution, metrics);
    }

    private <I, O> O runStage(Stage<I, O> stage, I input, JobRun run, int iteration) {
        StageName name = stage.name();
        run.job().setCurrentStage(name);
        String label = iteration == 0
                ? name.label()
                : "Refinement " + iteration + ": " + name.label();
        run.progress().report(name.key(), name.checkpoint(), label);
        return runner.run(stage, input, run, iteration);
    }

    // ------------------------------------------------------------------
    // Results
    // ------------------------------------------------------------------

    private JobResult success(JobRun run, Outcome outcome) {
        ScoredAttempt best = run.attempts().best().orElseThrow();
        log.info("Job {} {} with score {} after {} refinement iteration(s)",
                run.job().getId(), outcome, RefinementLoop.fmt(best.score()), run.refinementIterations());
        return new JobResult(run.job().getId(), true, JobState.SUCCEEDED, outcome, best,
                run.refinementIterations(), run.timings().snapshot(), run.warnings(), List.of());
    }

    private JobResult failure(JobRun run, Throwable e) {
        Classification c;
        String stage;
        if (e instanceof StageFailedException sfe) {
            c = sfe.getClassification();
            stage = sfe.getStage().key();
        } else {
            c = classifier.classify(e);
            StageName current = run.job().getCurrentStage();
            stage = current == null ? null : current.key();
        }
        log.error("Job {} FAILED in stage '{}' ({}): {}", run.job().getId(), stage, c.kind(), c.message());

        if (run.attempts().size() > 0) {
            run.warn("Attempts scored before the failure: " + run.attempts().scores().stream()
                    .map(RefinementLoop::fmt)
                    .collect(Collectors.joining(", ")));
        }
        JobError error = new JobError(c.kind(), stage, c.message(), c.suggestedAction(), c.diagnostics());
        return new JobResult(run.job().getId(), false, JobState.FAILED, Outcome.FAILED,
                run.attempts().best().orElse(null), run.refinementIterations(),
                run.timings().snapshot(), run.warnings(), List.of(error));
    }

    private JobResult finish(JobRun run, JobResult result) {
        meterRegistry.counter(OUTCOME_COUNTER, "outcome", result.outcome().name()).increment();
        run.job().complete(result);
        return result;
    }

    /** A stack overflow has already unwound with the stage call; other VM errors leave the JVM unusable. */
    static boolean isFatal(Throwable t) {
        return t instanceof VirtualMachineError && !(t instanceof StackOverflowError);
    }

    private static String abbreviate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 77) + "...";
    }
}
