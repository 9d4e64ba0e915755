package com.simforge.orchestrator.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only progress sink for one job.
 *
 * Tolerates a missing listener (every report is a no-op) and a failing one
 * (the exception is logged, the pipeline continues). Reports are forwarded in
 * call order. Within one attempt the forwarded fraction never decreases: a
 * lower value is raised to the highest value already reported.
 * {@link #beginAttempt()} starts a new attempt and resets that floor.
 *
 * Not thread-safe; a job reports from a single thread.
 */
public class ProgressReporter {

    private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);

    private final ProgressListener listener;
    private double floor = 0.0;

    public ProgressReporter(ProgressListener listener) {
        this.listener = listener;
    }

    public static ProgressReporter noop() {
        return new ProgressReporter(null);
    }

    public void report(String stage, double fraction, String message) {
        ProgressEvent event = new ProgressEvent(stage, fraction, message);
        if (listener == null) {
            return;
        }
        if (event.fraction() < floor) {
            event = new ProgressEvent(stage, floor, message);
        }
        floor = event.fraction();
        try {
            listener.onProgress(event);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed on stage '{}': {}", stage, e.getMessage());
        }
    }

    public void beginAttempt() {
        floor = 0.0;
    }
}
