package com.simforge.orchestrator.service;

import com.simforge.orchestrator.model.Job;
import com.simforge.orchestrator.model.JobOptions;
import com.simforge.orchestrator.progress.ProgressLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

/**
 * Job lifecycle for callers: submit, look up, cancel, delete.
 *
 * Each submitted job runs on the fixed worker pool; a job occupies one worker
 * from its first stage to its terminal result.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    public enum CancelOutcome { REQUESTED, ALREADY_REQUESTED, ALREADY_FINISHED, NOT_FOUND }

    public enum DeleteOutcome { DELETED, STILL_RUNNING, NOT_FOUND }

    private final PipelineOrchestrator orchestrator;
    private final JobRegistry          registry;
    private final ExecutorService      workers;

    public JobService(PipelineOrchestrator orchestrator,
                      JobRegistry registry,
                      @Qualifier("jobWorkers") ExecutorService workers) {
        this.orchestrator = orchestrator;
        this.registry     = registry;
        this.workers      = workers;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Register a new job and queue it on the worker pool.
     *
     * @throws IllegalArgumentException if the request is blank
     */
    public Job submit(String request, JobOptions options) {
        ProgressLog progress = new ProgressLog();
        Job job = new Job(request, options, progress);
        registry.register(new TrackedJob(job, progress));

        workers.submit(() -> {
            try {
                orchestrator.runJob(job);
            } catch (Throwable t) {
                // runJob publishes a result before letting a fatal VM error through.
                log.error("Job {} worker stopped by {}: {}", job.getId(), t.getClass().getSimpleName(),
                        t.getMessage(), t);
                if (t instanceof Error err) {
                    throw err;
                }
            }
        });
        log.info("Job {} submitted (refinement={}, maxIterations={})",
                job.getId(), options.refinementEnabled(), options.maxRefinementIterations());
        return job;
    }

    public Optional<TrackedJob> find(UUID id) {
        return registry.find(id);
    }

    /** Every registered job, oldest first. */
    public List<TrackedJob> list() {
        return registry.all().stream()
                .sorted(Comparator.comparing((TrackedJob t) -> t.job().getCreatedAt()))
                .toList();
    }

    // ------------------------------------------------------------------
    // Deletion
    // ------------------------------------------------------------------

    /**
     * Drop a finished job and everything recorded for it. A job that is still
     * running must be cancelled and allowed to finish first.
     */
    public DeleteOutcome delete(UUID id) {
        Optional<TrackedJob> tracked = registry.find(id);
        if (tracked.isEmpty()) {
            return DeleteOutcome.NOT_FOUND;
        }
        if (!tracked.get().job().getState().isTerminal()) {
            return DeleteOutcome.STILL_RUNNING;
        }
        registry.remove(id);
        log.info("Job {} deleted", id);
        return DeleteOutcome.DELETED;
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /**
     * Ask a job to stop. The orchestrator notices at its next stage or
     * iteration boundary; the best attempt scored so far is kept.
     */
    public CancelOutcome cancel(UUID id) {
        Optional<TrackedJob> tracked = registry.find(id);
        if (tracked.isEmpty()) {
            return CancelOutcome.NOT_FOUND;
        }
        Job job = tracked.get().job();
        if (job.getState().isTerminal()) {
            return CancelOutcome.ALREADY_FINISHED;
        }
        if (!job.requestCancel()) {
            return CancelOutcome.ALREADY_REQUESTED;
        }
        log.info("Cancellation requested for job {} (state={}, stage={})",
                id, job.getState(), job.getCurrentStage());
        return CancelOutcome.REQUESTED;
    }
}
