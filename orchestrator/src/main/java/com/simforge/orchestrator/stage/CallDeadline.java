package com.simforge.orchestrator.stage;

import com.simforge.orchestrator.error.FailureKind;
import com.simforge.orchestrator.error.StageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a blocking external call under a hard wall-clock deadline enforced by
 * the caller, not by the collaborator.
 *
 * On expiry the call's thread is interrupted and a TIMEOUT
 * {@link StageException} is raised. Exceptions thrown by the call itself are
 * rethrown unwrapped.
 */
public class CallDeadline {

    private static final Logger log = LoggerFactory.getLogger(CallDeadline.class);

    private final ExecutorService callers;

    public CallDeadline(ExecutorService callers) {
        this.callers = callers;
    }

    public <T> T call(String what, Duration timeout, Callable<T> call) {
        return call(what, timeout, call, () -> { });
    }

    /**
     * Like {@link #call(String, Duration, Callable)}, but {@code whenFinished}
     * runs exactly once, after the call itself has returned or thrown. If the
     * caller gives up first (deadline or interrupt) the call may still be
     * running; {@code whenFinished} then runs on the call's thread when it
     * ends, or at once if the call never started.
     */
    public <T> T call(String what, Duration timeout, Callable<T> call, Runnable whenFinished) {
        AtomicBoolean claimed = new AtomicBoolean();
        Future<T> future;
        try {
            future = callers.submit(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    return null;
                }
                try {
                    return call.call();
                } finally {
                    whenFinished.run();
                }
            });
        } catch (RejectedExecutionException e) {
            whenFinished.run();
            throw new StageException(FailureKind.UNKNOWN, what + " could not be scheduled: " + e.getMessage(), e);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon(future, claimed, whenFinished);
            log.warn("{} exceeded its {} ms deadline", what, timeout.toMillis());
            throw new StageException(FailureKind.TIMEOUT,
                    what + " did not finish within " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            abandon(future, claimed, whenFinished);
            Thread.currentThread().interrupt();
            throw new StageException(FailureKind.CANCELLED, what + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new StageException(FailureKind.UNKNOWN, what + " failed: " + cause.getMessage(), cause);
        }
    }

    private static void abandon(Future<?> future, AtomicBoolean claimed, Runnable whenFinished) {
        future.cancel(true);
        // Not started yet: it never will, so finish on its behalf.
        if (claimed.compareAndSet(false, true)) {
            whenFinished.run();
        }
    }
}
