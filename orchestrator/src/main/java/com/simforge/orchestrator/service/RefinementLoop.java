package com.simforge.orchestrator.service;

import com.simforge.orchestrator.config.PipelineConfig;
import com.simforge.orchestrator.model.JobOptions;
import com.simforge.orchestrator.model.JobState;
import com.simforge.orchestrator.model.Outcome;
import com.simforge.orchestrator.model.ScoredAttempt;
import com.simforge.orchestrator.stage.PlanningInput;
import com.simforge.orchestrator.stage.impl.FeedbackBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Locale;

/**
 * Quality-gated refinement around the attempt pipeline.
 *
 * <pre>
 *   ATTEMPTING → SCORING → ACCEPTED
 *                        → REFINING → ATTEMPTING ...
 *                        → EXHAUSTED_FALLBACK (budget spent, best attempt kept)
 * </pre>
 *
 * Every attempt that reaches scoring is offered to the job's
 * {@link BestAttemptTracker}; a refinement iteration re-plans from the best
 * attempt so far plus feedback built from its quality issues, so a regressed
 * attempt is never the base of the next one. The number of iterations is the
 * smaller of the job's own limit and the configured cap.
 */
public class RefinementLoop {

    private static final Logger log = LoggerFactory.getLogger(RefinementLoop.class);

    /** Runs the six stages once and returns the scored attempt. */
    @FunctionalInterface
    public interface AttemptExecutor {
        ScoredAttempt attempt(JobRun run, PlanningInput input, int iteration);
    }

    private final PipelineConfig config;

    public RefinementLoop(PipelineConfig config) {
        this.config = config;
    }

    public Outcome run(JobRun run, AttemptExecutor executor) {
        JobOptions options = run.job().getOptions();
        int budget = Math.min(options.iterationBudget(), config.maxRefinementIterationsCap());
        double threshold = config.qualityThreshold();

        PlanningInput input = PlanningInput.initial(run.job().getRequest());
        for (int iteration = 0; ; iteration++) {
            run.checkCancelled("before iteration " + iteration);
            MDC.put("iteration", String.valueOf(iteration));

            ScoredAttempt attempt = executor.attempt(run, input, iteration);
            boolean improved = run.attempts().offer(attempt);
            log.info("Attempt {} scored {} (threshold {}){}", attempt.sequence(),
                    fmt(attempt.score()), fmt(threshold), improved ? ", new best" : "");

            if (attempt.metrics().meets(threshold)) {
                return Outcome.ACCEPTED;
            }
            ScoredAttempt base = run.attempts().best().orElseThrow();
            double best = base.score();
            if (!options.refinementEnabled()) {
                run.warn("Quality score " + fmt(best) + " is below threshold " + fmt(threshold)
                        + " and refinement is disabled");
                return Outcome.BELOW_THRESHOLD;
            }
            if (iteration >= budget) {
                run.warn("Quality threshold " + fmt(threshold) + " not met after " + iteration
                        + " refinement iteration(s); returning best attempt with score " + fmt(best));
                return Outcome.EXHAUSTED_FALLBACK;
            }

            int next = iteration + 1;
            run.checkCancelled("before refinement iteration " + next);
            run.startRefinementIteration(next);
            run.job().setState(JobState.REFINING);
            log.info("Refining (iteration {}/{})", next, budget);
            input = PlanningInput.refinement(run.job().getRequest(), base.plan(),
                    FeedbackBuilder.build(base.metrics(), threshold));
        }
    }

    static String fmt(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
