package com.simforge.orchestrator.service;

import com.simforge.orchestrator.Fixtures;
import com.simforge.orchestrator.model.ScoredAttempt;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BestAttemptTrackerTest {

    @Test
    void offer_keepsHighestScore() {
        BestAttemptTracker tracker = new BestAttemptTracker();

        assertThat(tracker.offer(Fixtures.attempt(0, 0.5))).isTrue();
        assertThat(tracker.offer(Fixtures.attempt(1, 0.7))).isTrue();
        assertThat(tracker.offer(Fixtures.attempt(2, 0.6))).isFalse();

        assertThat(tracker.best()).get().extracting(ScoredAttempt::sequence).isEqualTo(1);
        assertThat(tracker.scores()).containsExactly(0.5, 0.7, 0.6);
        assertThat(tracker.size()).isEqualTo(3);
    }

    @Test
    void offer_equalScore_keepsEarlierAttempt() {
        BestAttemptTracker tracker = new BestAttemptTracker();

        tracker.offer(Fixtures.attempt(0, 0.6));
        assertThat(tracker.offer(Fixtures.attempt(1, 0.6))).isFalse();

        assertThat(tracker.best()).get().extracting(ScoredAttempt::sequence).isEqualTo(0);
    }

    @Test
    void best_emptyTracker_isEmpty() {
        assertThat(new BestAttemptTracker().best()).isEmpty();
    }

    @Test
    void comparator_ordersScoreDescendingThenSequence() {
        assertThat(BestAttemptTracker.BEST_FIRST.compare(Fixtures.attempt(3, 0.9), Fixtures.attempt(0, 0.5)))
                .isNegative();
        assertThat(BestAttemptTracker.BEST_FIRST.compare(Fixtures.attempt(0, 0.5), Fixtures.attempt(3, 0.5)))
                .isNegative();
    }
}
