package com.rms.relay.core.error;

/**
 * Root of the relay's failure taxonomy.
 *
 * <p>Each subtype states whether the failure is worth retrying. Retry wrappers use
 * {@link #isRetryable(Throwable)} as their default predicate; anything outside this hierarchy is
 * treated as non-retryable unless a component says otherwise.</p>
 */
public abstract class RelayException extends RuntimeException {

    private final boolean retryable;

    protected RelayException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public static boolean isRetryable(Throwable t) {
        return t instanceof RelayException re && re.isRetryable();
    }
}
