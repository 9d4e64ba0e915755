package com.simforge.orchestrator.stage.impl;

import com.simforge.orchestrator.Fixtures;
import com.simforge.orchestrator.error.FailureKind;
import com.simforge.orchestrator.error.StageException;
import com.simforge.orchestrator.execution.ExecutionEnvironment;
import com.simforge.orchestrator.execution.ExecutionLimiter;
import com.simforge.orchestrator.execution.SceneInspector;
import com.simforge.orchestrator.model.EnrichedPlan;
import com.simforge.orchestrator.model.ExecutionRecord;
import com.simforge.orchestrator.model.ValidatedArtifact;
import com.simforge.orchestrator.model.ValidationOutcome;
import com.simforge.orchestrator.progress.ProgressReporter;
import com.simforge.orchestrator.stage.CallDeadline;
import com.simforge.orchestrator.stage.ExecutionInput;
import com.simforge.orchestrator.stage.StageContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExecutionStageTest {

    @Mock ExecutionEnvironment environment;
    @Mock SceneInspector       inspector;

    private final ExecutorService  callers = Executors.newCachedThreadPool();
    private final ExecutionLimiter limiter = new ExecutionLimiter(1);
    private final StageContext     ctx     = new StageContext(UUID.randomUUID(), 1, 0, ProgressReporter.noop());
    private final EnrichedPlan     plan    = Fixtures.enriched(Fixtures.rigidBodyPlan());
    private final ExecutionInput   input   = new ExecutionInput(new ValidatedArtifact(Fixtures.artifact(),
            new ValidationOutcome(true, List.of(), false)), plan);

    // Calls currently inside the environment, and the most seen at once.
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger peak   = new AtomicInteger();

    @AfterEach
    void tearDown() {
        callers.shutdownNow();
    }

    private ExecutionStage stage(Duration executionTimeout) {
        return new ExecutionStage(environment, inspector, limiter, new CallDeadline(callers),
                executionTimeout, Duration.ofSeconds(5));
    }

    private ExecutionStage stage() {
        return stage(Duration.ofSeconds(5));
    }

    // ------------------------------------------------------------------
    // Completed runs
    // ------------------------------------------------------------------

    @Test
    void execute_success_attachesInspectionAndReleasesSlot() {
        when(environment.execute(any(), any())).thenAnswer(inv -> {
            assertThat(limiter.heldCount()).isEqualTo(1);
            return Fixtures.executed();
        });
        when(inspector.inspect(any(), eq(plan), any())).thenAnswer(inv -> {
            assertThat(limiter.heldCount()).isEqualTo(1);
            return Fixtures.sceneWithoutPhysics();
        });

        ExecutionRecord record = stage().execute(input, ctx);

        assertThat(record.success()).isTrue();
        assertThat(record.inspection()).isEqualTo(Fixtures.sceneWithoutPhysics());
        assertThat(limiter.heldCount()).isZero();
    }

    @Test
    void execute_unsuccessfulRun_isExecutionFailureWithDiagnostics() {
        when(environment.execute(any(), any())).thenReturn(ExecutionRecord.failed(
                "Blender exited with code 1", "", "Error: bad context", 1, Duration.ofSeconds(1)));

        assertThatThrownBy(() -> stage().execute(input, ctx))
                .isInstanceOf(StageException.class)
                .satisfies(e -> {
                    StageException se = (StageException) e;
                    assertThat(se.getKind()).isEqualTo(FailureKind.EXECUTION_FAILURE);
                    assertThat(se.getDiagnostics()).contains("Error: bad context");
                });
        assertThat(limiter.heldCount()).isZero();
    }

    @Test
    void execute_environmentThrows_releasesSlot() {
        when(environment.execute(any(), any())).thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> stage().execute(input, ctx)).isInstanceOf(IllegalStateException.class);
        assertThat(limiter.heldCount()).isZero();
    }

    @Test
    void execute_inspectionFails_releasesSlot() {
        when(environment.execute(any(), any())).thenReturn(Fixtures.executed());
        when(inspector.inspect(any(), any(), any())).thenThrow(new StageException(
                FailureKind.EXECUTION_FAILURE, "Scene inspection exited with code 1"));

        assertThatThrownBy(() -> stage().execute(input, ctx))
                .isInstanceOf(StageException.class)
                .hasMessageContaining("Scene inspection");
        assertThat(limiter.heldCount()).isZero();
    }

    // ------------------------------------------------------------------
    // Abandoned calls keep their slot until they end
    // ------------------------------------------------------------------

    @Test
    void execute_deadlineExpires_slotHeldUntilRunEndsAndNeverOversubscribed() throws Exception {
        when(environment.execute(any(), any())).thenAnswer(inv -> busyFor(Duration.ofMillis(500)));
        ExecutionStage stage = stage(Duration.ofMillis(100));

        assertThatThrownBy(() -> stage.execute(input, ctx))
                .isInstanceOf(StageException.class)
                .hasMessageContaining("within 100 ms")
                .extracting(e -> ((StageException) e).getKind())
                .isEqualTo(FailureKind.TIMEOUT);
        assertThat(limiter.heldCount()).isEqualTo(1);

        // The retry waits for the abandoned run before it gets the slot.
        assertThatThrownBy(() -> stage.execute(input, ctx))
                .extracting(e -> ((StageException) e).getKind())
                .isEqualTo(FailureKind.TIMEOUT);

        awaitAllSlotsFree();
        verify(environment, times(2)).execute(any(), any());
        assertThat(peak.get()).isEqualTo(1);
    }

    @Test
    void execute_jobThreadInterrupted_slotHeldUntilRunEnds() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch finish  = new CountDownLatch(1);
        when(environment.execute(any(), any())).thenAnswer(inv -> {
            enter();
            try {
                started.countDown();
                awaitIgnoringInterrupts(finish);
                return Fixtures.executed();
            } finally {
                active.decrementAndGet();
            }
        });

        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread jobThread = new Thread(() -> {
            try {
                stage().execute(input, ctx);
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        jobThread.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        jobThread.interrupt();
        jobThread.join(5_000);

        assertThat(failure.get()).isInstanceOf(StageException.class)
                .extracting(e -> ((StageException) e).getKind())
                .isEqualTo(FailureKind.CANCELLED);
        assertThat(limiter.heldCount()).isEqualTo(1);

        finish.countDown();
        awaitAllSlotsFree();
        assertThat(peak.get()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void enter() {
        peak.accumulateAndGet(active.incrementAndGet(), Math::max);
    }

    /** Spins without looking at the interrupt flag, like a call that cannot be interrupted. */
    private ExecutionRecord busyFor(Duration duration) {
        enter();
        try {
            long end = System.nanoTime() + duration.toNanos();
            while (System.nanoTime() < end) {
                Thread.onSpinWait();
            }
            return Fixtures.executed();
        } finally {
            active.decrementAndGet();
        }
    }

    private static void awaitIgnoringInterrupts(CountDownLatch latch) {
        boolean interrupted = false;
        while (true) {
            try {
                latch.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void awaitAllSlotsFree() throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (limiter.heldCount() > 0 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(limiter.heldCount()).isZero();
    }
}
