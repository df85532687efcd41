package com.rms.relay.config;

import java.time.Duration;
import java.util.function.Predicate;

import com.rms.relay.core.retry.BackoffPolicy;
import com.rms.relay.core.retry.RetryExecutor;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Retry settings for one retried component.
 *
 * <pre>
 * max-retries: 3          # 0 = single attempt
 * initial-backoff: 1s
 * max-backoff: 30s
 * backoff-multiplier: 2.0
 * </pre>
 *
 * Cross-field rules (max >= initial, initial > 0) are enforced by {@link BackoffPolicy} when the
 * executor is built at startup.
 */
public class RetryProperties {

    @PositiveOrZero
    private int maxRetries = 3;

    @NotNull
    private Duration initialBackoff = Duration.ofSeconds(1);

    @NotNull
    private Duration maxBackoff = Duration.ofSeconds(30);

    @DecimalMin("1.0")
    private double backoffMultiplier = 2.0;

    public BackoffPolicy toBackoffPolicy() {
        return new BackoffPolicy(initialBackoff, maxBackoff, backoffMultiplier);
    }

    public RetryExecutor toExecutor(String operation, Predicate<Throwable> retryable) {
        return new RetryExecutor(operation, maxRetries, toBackoffPolicy(), retryable);
    }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public Duration getInitialBackoff() { return initialBackoff; }
    public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }

    public Duration getMaxBackoff() { return maxBackoff; }
    public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }

    public double getBackoffMultiplier() { return backoffMultiplier; }
    public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
}
