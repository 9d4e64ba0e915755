package com.simforge.orchestrator.service;

import com.simforge.orchestrator.config.PipelineConfig;
import com.simforge.orchestrator.error.FailureKind;

import java.time.Duration;
import java.util.function.DoubleSupplier;

/**
 * Attempt budgets per failure kind and the pause before each retry.
 *
 * Non-retryable kinds get a single attempt. VALIDATION_FAILURE gets its own,
 * smaller budget because its only retry is the auto-fixed script.
 * Backoff grows exponentially from {@code initialBackoff}, is capped at
 * {@code maxBackoff}, and is then spread by ±{@code jitter}.
 */
public class RetryPolicy {

    private final int            maxStageAttempts;
    private final int            validationMaxAttempts;
    private final Duration       initialBackoff;
    private final Duration       maxBackoff;
    private final double         multiplier;
    private final double         jitter;
    private final DoubleSupplier random;

    public RetryPolicy(PipelineConfig config) {
        this(config, Math::random);
    }

    public RetryPolicy(PipelineConfig config, DoubleSupplier random) {
        this.maxStageAttempts      = config.maxStageAttempts();
        this.validationMaxAttempts = config.validationMaxAttempts();
        this.initialBackoff        = config.initialBackoff();
        this.maxBackoff            = config.maxBackoff();
        this.multiplier            = config.backoffMultiplier();
        this.jitter                = config.backoffJitter();
        this.random                = random;
    }

    public int maxAttempts(FailureKind kind) {
        if (!kind.retryable()) {
            return 1;
        }
        return kind == FailureKind.VALIDATION_FAILURE ? validationMaxAttempts : maxStageAttempts;
    }

    /** @param attempt the 1-based attempt that just failed */
    public boolean shouldRetry(FailureKind kind, int attempt) {
        return attempt < maxAttempts(kind);
    }

    /** @param attempt the 1-based attempt that just failed */
    public Duration backoff(int attempt) {
        double base = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        double capped = Math.min(base, maxBackoff.toMillis());
        double spread = 1.0 + jitter * (2.0 * random.getAsDouble() - 1.0);
        return Duration.ofMillis(Math.max(0L, Math.round(capped * spread)));
    }
}
