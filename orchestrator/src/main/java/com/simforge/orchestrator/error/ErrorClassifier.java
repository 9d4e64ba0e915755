package com.simforge.orchestrator.error;

import org.springframework.stereotype.Component;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Maps any failure raised while running a stage to exactly one
 * {@link FailureKind}.
 *
 * Total: unrecognised failures classify as {@link FailureKind#UNKNOWN}, so the
 * orchestrator never has to look at a raw exception itself.
 *
 * Precedence, first match wins:
 * <ol>
 *   <li>{@link StageException} at the top of the chain: its own kind.</li>
 *   <li>Cancellation anywhere in the chain: CANCELLED.</li>
 *   <li>A timeout anywhere in the chain: TIMEOUT.</li>
 *   <li>A {@link StageException} deeper in the chain: its kind.</li>
 *   <li>Otherwise UNKNOWN.</li>
 * </ol>
 */
@Component
public class ErrorClassifier {

    // Bound on cause-chain traversal; guards against cyclic causes.
    private static final int MAX_DEPTH = 16;

    public Classification classify(Throwable failure) {
        if (failure == null) {
            return of(FailureKind.UNKNOWN, "Unknown failure (null)", null);
        }
        if (failure instanceof StageException se) {
            return of(se.getKind(), messageOf(se), se.getDiagnostics());
        }

        StageException nested = null;
        Throwable t = failure;
        for (int depth = 0; t != null && depth < MAX_DEPTH; depth++, t = t.getCause()) {
            if (isCancellation(t)) {
                return of(FailureKind.CANCELLED, messageOf(t), null);
            }
            if (isTimeout(t)) {
                return of(FailureKind.TIMEOUT, messageOf(failure), null);
            }
            if (nested == null && t instanceof StageException se) {
                nested = se;
            }
        }
        if (nested != null) {
            return of(nested.getKind(), messageOf(nested), nested.getDiagnostics());
        }
        return of(FailureKind.UNKNOWN, messageOf(failure), null);
    }

    private static Classification of(FailureKind kind, String message, String diagnostics) {
        return new Classification(kind, kind.retryable(), message, kind.suggestedAction(), diagnostics);
    }

    private static boolean isCancellation(Throwable t) {
        return t instanceof JobCancelledException
            || t instanceof InterruptedException
            || t instanceof CancellationException;
    }

    private static boolean isTimeout(Throwable t) {
        return t instanceof TimeoutException
            || t instanceof HttpTimeoutException
            || t instanceof SocketTimeoutException;
    }

    private static String messageOf(Throwable t) {
        String msg = t.getMessage();
        return (msg == null || msg.isBlank()) ? t.getClass().getSimpleName() : msg;
    }
}
