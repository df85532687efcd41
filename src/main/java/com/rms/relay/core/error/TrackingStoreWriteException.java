package com.rms.relay.core.error;

/**
 * Persisting the watermark or run record failed.
 *
 * <p>When this follows a successful publish, the bus is ahead of the tracking store: the next
 * cycle re-fetches and redelivers events that are already on the stream. That is allowed under
 * at-least-once delivery, but it must be visible, so this failure is never folded into an ordinary
 * failed cycle.</p>
 */
public class TrackingStoreWriteException extends RelayException {

    public TrackingStoreWriteException(String message) {
        super(message, null, false);
    }

    public TrackingStoreWriteException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
