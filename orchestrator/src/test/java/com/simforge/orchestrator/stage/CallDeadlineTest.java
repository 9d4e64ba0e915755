package com.simforge.orchestrator.stage;

import com.simforge.orchestrator.error.FailureKind;
import com.simforge.orchestrator.error.StageException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CallDeadlineTest {

    private final ExecutorService callers  = Executors.newCachedThreadPool();
    private final CallDeadline    deadline = new CallDeadline(callers);

    @AfterEach
    void tearDown() {
        callers.shutdownNow();
    }

    @Test
    void call_finishesInTime_returnsValue() {
        assertThat(deadline.call("Quick", Duration.ofSeconds(5), () -> 42)).isEqualTo(42);
    }

    @Test
    void call_exceedsDeadline_throwsTimeoutAndInterruptsCall() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);

        assertThatThrownBy(() -> deadline.call("Slow call", Duration.ofMillis(50), () -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
            return null;
        }))
                .isInstanceOf(StageException.class)
                .hasMessageContaining("Slow call")
                .extracting(e -> ((StageException) e).getKind())
                .isEqualTo(FailureKind.TIMEOUT);

        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void call_exceedsDeadline_runsWhenFinishedOnlyAfterCallEnds() throws Exception {
        CountDownLatch release  = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);

        assertThatThrownBy(() -> deadline.call("Stubborn call", Duration.ofMillis(50), () -> {
            while (true) {
                try {
                    release.await();
                    return null;
                } catch (InterruptedException ignored) {
                    // keeps running past its deadline
                }
            }
        }, finished::countDown))
                .isInstanceOf(StageException.class)
                .hasMessageContaining("within 50 ms");

        assertThat(finished.await(200, TimeUnit.MILLISECONDS)).isFalse();
        release.countDown();
        assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void call_poolShutDown_runsWhenFinishedAndFails() {
        ExecutorService stopped = Executors.newSingleThreadExecutor();
        stopped.shutdown();
        AtomicInteger finished = new AtomicInteger();

        assertThatThrownBy(() -> new CallDeadline(stopped).call("Late", Duration.ofSeconds(5), () -> 1,
                finished::incrementAndGet))
                .isInstanceOf(StageException.class);
        assertThat(finished.get()).isEqualTo(1);
    }

    @Test
    void call_errorFromCall_isRethrownUnwrapped() {
        AssertionError error = new AssertionError("broken invariant");

        assertThatThrownBy(() -> deadline.call("Broken", Duration.ofSeconds(5), () -> { throw error; }))
                .isSameAs(error);
    }

    @Test
    void call_runtimeFailure_isRethrownUnwrapped() {
        StageException failure = new StageException(FailureKind.PLANNING_FAILURE, "bad plan");

        assertThatThrownBy(() -> deadline.call("Planning", Duration.ofSeconds(5), () -> { throw failure; }))
                .isSameAs(failure);
    }

    @Test
    void call_checkedFailure_isUnknown() {
        assertThatThrownBy(() -> deadline.call("Io", Duration.ofSeconds(5), () -> { throw new IOException("disk"); }))
                .isInstanceOf(StageException.class)
                .extracting(e -> ((StageException) e).getKind())
                .isEqualTo(FailureKind.UNKNOWN);
    }
}
