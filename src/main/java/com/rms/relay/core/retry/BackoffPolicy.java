package com.rms.relay.core.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff without jitter.
 *
 * <p>{@code backoff(k) = min(maxBackoff, initialBackoff * multiplier^k)}</p>
 *
 * <p>Invalid settings are rejected in the constructor so a bad configuration fails at startup,
 * not on the first retry.</p>
 */
public final class BackoffPolicy {

    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final double multiplier;

    public BackoffPolicy(Duration initialBackoff, Duration maxBackoff, double multiplier) {
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (initialBackoff.isZero() || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be > 0, got " + initialBackoff);
        }
        if (Double.isNaN(multiplier) || multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1, got " + multiplier);
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException(
                    "maxBackoff (" + maxBackoff + ") must be >= initialBackoff (" + initialBackoff + ")");
        }
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.multiplier = multiplier;
    }

    /**
     * @param attempt zero-based index of the attempt that just failed
     */
    public Duration backoff(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, got " + attempt);
        }
        double nanos = initialBackoff.toNanos() * Math.pow(multiplier, attempt);
        if (Double.isInfinite(nanos) || nanos >= maxBackoff.toNanos()) {
            return maxBackoff;
        }
        return Duration.ofNanos((long) nanos);
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public double getMultiplier() {
        return multiplier;
    }

    @Override
    public String toString() {
        return "BackoffPolicy{initial=" + initialBackoff + ", max=" + maxBackoff + ", multiplier=" + multiplier + "}";
    }
}
