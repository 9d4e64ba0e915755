package com.simforge.orchestrator.service;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory index of submitted jobs. Finished jobs stay until removed through
 * {@link #remove(UUID)}; when to remove them is the caller's policy.
 */
@Component
public class JobRegistry {

    private final Map<UUID, TrackedJob> jobs = new ConcurrentHashMap<>();

    public void register(TrackedJob tracked) {
        UUID id = tracked.job().getId();
        if (jobs.putIfAbsent(id, tracked) != null) {
            throw new IllegalStateException("Job " + id + " is already registered");
        }
    }

    public Optional<TrackedJob> find(UUID id) {
        return Optional.ofNullable(jobs.get(id));
    }

    public Optional<TrackedJob> remove(UUID id) {
        return Optional.ofNullable(jobs.remove(id));
    }

    public Collection<TrackedJob> all() {
        return List.copyOf(jobs.values());
    }

    public long countActive() {
        return jobs.values().stream().filter(t -> !t.job().getState().isTerminal()).count();
    }
}
