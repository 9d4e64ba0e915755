package com.simforge.orchestrator.progress;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProgressReporterTest {

    @Test
    void report_deliversEventsInCallOrder() {
        ProgressLog log = new ProgressLog();
        ProgressReporter reporter = new ProgressReporter(log);

        reporter.report("plan", 0.10, "Planning");
        reporter.report("enrich", 0.25, "Enriching");

        assertThat(log.events()).extracting(ProgressEvent::stage).containsExactly("plan", "enrich");
        assertThat(log.latest()).get().extracting(ProgressEvent::fraction).isEqualTo(0.25);
    }

    @Test
    void report_lowerFractionWithinAttempt_isRaisedToPrevious() {
        ProgressLog log = new ProgressLog();
        ProgressReporter reporter = new ProgressReporter(log);

        reporter.report("execute", 0.70, "Executing");
        reporter.report("plan", 0.10, "Planning again");

        assertThat(log.events()).extracting(ProgressEvent::fraction).containsExactly(0.70, 0.70);
    }

    @Test
    void beginAttempt_resetsFloor() {
        ProgressLog log = new ProgressLog();
        ProgressReporter reporter = new ProgressReporter(log);

        reporter.report("score", 0.90, "Scoring");
        reporter.beginAttempt();
        reporter.report("plan", 0.10, "Refinement 1: Planning");

        assertThat(log.events()).extracting(ProgressEvent::fraction).containsExactly(0.90, 0.10);
    }

    @Test
    void report_fractionOutOfRange_throws() {
        ProgressReporter reporter = new ProgressReporter(new ProgressLog());

        assertThatThrownBy(() -> reporter.report("plan", 1.5, "nope"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> reporter.report("plan", -0.1, "nope"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void report_withoutListener_isNoop() {
        assertThatCode(() -> ProgressReporter.noop().report("plan", 0.1, "Planning"))
                .doesNotThrowAnyException();
    }

    @Test
    void report_throwingListener_doesNotPropagate() {
        ProgressReporter reporter = new ProgressReporter(e -> { throw new IllegalStateException("boom"); });

        assertThatCode(() -> reporter.report("plan", 0.1, "Planning")).doesNotThrowAnyException();
    }
}
