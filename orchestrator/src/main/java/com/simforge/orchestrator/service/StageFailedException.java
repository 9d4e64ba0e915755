package com.simforge.orchestrator.service;

import com.simforge.orchestrator.error.Classification;
import com.simforge.orchestrator.model.StageName;

/**
 * A stage failed for good: its failure was not retryable or its attempt
 * budget is spent. Carries the classification the job error is built from.
 */
public class StageFailedException extends RuntimeException {

    private final StageName      stage;
    private final Classification classification;
    private final int            attempts;

    public StageFailedException(StageName stage, Classification classification, int attempts, Throwable cause) {
        super("Stage '" + stage.key() + "' failed after " + attempts + " attempt(s): "
                + classification.message(), cause);
        this.stage          = stage;
        this.classification = classification;
        this.attempts       = attempts;
    }

    public StageName      getStage()          { return stage; }
    public Classification getClassification() { return classification; }
    public int            getAttempts()       { return attempts; }
}
