package com.rms.relay.core.error;

/**
 * An envelope cannot be turned into a bus message (unserializable payload, oversized body).
 * Detected before any network call and never retried.
 */
public class MalformedEventException extends RelayException {

    private final String eventId;

    public MalformedEventException(String eventId, String message, Throwable cause) {
        super(message, cause, false);
        this.eventId = eventId;
    }

    public String getEventId() {
        return eventId;
    }
}
