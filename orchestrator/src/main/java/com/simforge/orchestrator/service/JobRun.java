package com.simforge.orchestrator.service;

import com.simforge.orchestrator.error.JobCancelledException;
import com.simforge.orchestrator.model.Job;
import com.simforge.orchestrator.progress.ProgressReporter;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable working state of one job while the orchestrator runs it.
 * Confined to the job's thread; only {@link Job}'s cancel flag is shared.
 */
public class JobRun {

    private final Job                job;
    private final ProgressReporter   progress;
    private final StageTimings       timings  = new StageTimings();
    private final BestAttemptTracker attempts = new BestAttemptTracker();
    private final Set<String>        warnings = new LinkedHashSet<>();

    private int refinementIterations;
    private int nextSequence;

    public JobRun(Job job) {
        this.job      = job;
        this.progress = new ProgressReporter(job.getProgressListener());
    }

    public Job                job()      { return job; }
    public ProgressReporter   progress() { return progress; }
    public StageTimings       timings()  { return timings; }
    public BestAttemptTracker attempts() { return attempts; }

    public void warn(String warning) {
        warnings.add(warning);
    }

    public void warnAll(List<String> more) {
        warnings.addAll(more);
    }

    public List<String> warnings() {
        return new ArrayList<>(warnings);
    }

    public int refinementIterations() {
        return refinementIterations;
    }

    public void startRefinementIteration(int iteration) {
        this.refinementIterations = iteration;
    }

    public int nextSequence() {
        return nextSequence++;
    }

    public void checkCancelled(String where) {
        if (job.isCancelRequested()) {
            throw new JobCancelledException(job.getId(), where);
        }
    }
}
