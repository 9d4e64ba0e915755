package com.simforge.orchestrator.progress;

/**
 * One progress notification.
 *
 * @param stage    stage key, or "complete" for the terminal report
 * @param fraction overall progress of the current attempt, 0..1
 * @param message  human-readable status, may be null
 */
public record ProgressEvent(String stage, double fraction, String message) {

    public ProgressEvent {
        if (stage == null || stage.isBlank()) {
            throw new IllegalArgumentException("stage must not be blank");
        }
        if (Double.isNaN(fraction) || fraction < 0.0 || fraction > 1.0) {
            throw new IllegalArgumentException("fraction must be within 0..1, got " + fraction);
        }
    }
}
