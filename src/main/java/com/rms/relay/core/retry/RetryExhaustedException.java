package com.rms.relay.core.retry;

import java.util.OptionalInt;

/**
 * Attached as a suppressed exception to the final failure of an exhausted retry loop.
 *
 * <p>The final failure itself is re-thrown unchanged so callers keep matching on its type; this
 * marker only records how many attempts were made.</p>
 */
public final class RetryExhaustedException extends RuntimeException {

    private final String operation;
    private final int attempts;

    RetryExhaustedException(String operation, int attempts) {
        super(operation + " gave up after " + attempts + " attempt(s)", null, false, false);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * Attempt count recorded on {@code failure} by an exhausted retry loop, if any.
     */
    public static OptionalInt attemptsOf(Throwable failure) {
        if (failure == null) {
            return OptionalInt.empty();
        }
        for (Throwable s : failure.getSuppressed()) {
            if (s instanceof RetryExhaustedException r) {
                return OptionalInt.of(r.getAttempts());
            }
        }
        return OptionalInt.empty();
    }
}
