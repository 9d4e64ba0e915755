package com.simforge.orchestrator.model;

import com.simforge.orchestrator.progress.ProgressListener;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One simulation request submitted by a caller.
 *
 * State and current stage are written only by the orchestrator thread that
 * runs the job; other threads read them (volatile) and may only raise the
 * cancellation flag. The terminal {@link JobResult} is published once.
 */
public class Job {

    private final UUID             id;
    private final String           request;
    private final JobOptions       options;
    private final ProgressListener progressListener;
    private final Instant          createdAt;

    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    private volatile JobState  state = JobState.PENDING;
    private volatile StageName currentStage;
    private volatile Instant   updatedAt;
    private volatile JobResult result;

    public Job(String request, JobOptions options, ProgressListener progressListener) {
        this(UUID.randomUUID(), request, options, progressListener);
    }

    public Job(UUID id, String request, JobOptions options, ProgressListener progressListener) {
        if (request == null || request.isBlank()) {
            throw new IllegalArgumentException("request must not be blank");
        }
        this.id               = id;
        this.request          = request;
        this.options          = options;
        this.progressListener = progressListener;
        this.createdAt        = Instant.now();
        this.updatedAt        = createdAt;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID             getId()               { return id; }
    public String           getRequest()          { return request; }
    public JobOptions       getOptions()          { return options; }
    public ProgressListener getProgressListener() { return progressListener; }
    public Instant          getCreatedAt()        { return createdAt; }
    public Instant          getUpdatedAt()        { return updatedAt; }
    public JobState         getState()            { return state; }
    public StageName        getCurrentStage()     { return currentStage; }
    public JobResult        getResult()           { return result; }

    // ------------------------------------------------------------------
    // Mutators (orchestrator only)
    // ------------------------------------------------------------------

    public void setState(JobState state) {
        this.state     = state;
        this.updatedAt = Instant.now();
    }

    public void setCurrentStage(StageName stage) {
        this.currentStage = stage;
        this.updatedAt    = Instant.now();
    }

    public void complete(JobResult result) {
        this.result = result;
        setState(result.status());
    }

    // ------------------------------------------------------------------
    // Cooperative cancellation
    // ------------------------------------------------------------------

    /** @return true if this call raised the flag, false if it was already raised */
    public boolean requestCancel() {
        return cancelRequested.compareAndSet(false, true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }
}
