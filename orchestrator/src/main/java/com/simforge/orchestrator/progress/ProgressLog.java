package com.simforge.orchestrator.progress;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Listener that keeps every event so a polling caller can read them later.
 *
 * Written by the job's worker thread and read by request threads, hence the
 * synchronized accessors.
 */
public class ProgressLog implements ProgressListener {

    private final List<ProgressEvent> events = new ArrayList<>();

    @Override
    public synchronized void onProgress(ProgressEvent event) {
        events.add(event);
    }

    public synchronized List<ProgressEvent> events() {
        return List.copyOf(events);
    }

    public synchronized Optional<ProgressEvent> latest() {
        return events.isEmpty() ? Optional.empty() : Optional.of(events.get(events.size() - 1));
    }
}
