package com.simforge.orchestrator.error;

import java.util.UUID;

/**
 * Raised at a stage or iteration boundary once the caller has asked for
 * cancellation.
 */
public class JobCancelledException extends RuntimeException {

    public JobCancelledException(UUID jobId, String where) {
        super("Job " + jobId + " cancelled " + where);
    }
}
