package com.simforge.orchestrator.service;

import com.simforge.orchestrator.model.ScoredAttempt;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Remembers the best-scoring attempt of a job.
 *
 * Ordering is score descending, then sequence ascending, so a later attempt
 * replaces the best only when it scores strictly higher.
 */
public class BestAttemptTracker {

    public static final Comparator<ScoredAttempt> BEST_FIRST =
            Comparator.comparingDouble(ScoredAttempt::score).reversed()
                      .thenComparingInt(ScoredAttempt::sequence);

    private final List<ScoredAttempt> offered = new ArrayList<>();
    private ScoredAttempt best;

    /** @return true if {@code attempt} became the new best */
    public boolean offer(ScoredAttempt attempt) {
        offered.add(attempt);
        if (best == null || BEST_FIRST.compare(attempt, best) < 0) {
            best = attempt;
            return true;
        }
        return false;
    }

    public Optional<ScoredAttempt> best() {
        return Optional.ofNullable(best);
    }

    /** Scores of every offered attempt, in offer order. */
    public List<Double> scores() {
        return offered.stream().map(ScoredAttempt::score).toList();
    }

    public int size() {
        return offered.size();
    }
}
