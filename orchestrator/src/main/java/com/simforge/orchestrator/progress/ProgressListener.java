package com.simforge.orchestrator.progress;

/**
 * Receives progress events for one job.
 *
 * Called synchronously on the job's worker thread, in report order.
 * Implementations should return quickly; delivery to remote callers is
 * their own concern.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(ProgressEvent event);
}
