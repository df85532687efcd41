package com.rms.relay.core.error;

/**
 * The bus connection is not usable right now (not connected, closed, reconnecting, I/O error,
 * ack timeout). Retryable.
 */
public class ConnectionUnavailableException extends RelayException {

    public ConnectionUnavailableException(String message) {
        super(message, null, true);
    }

    public ConnectionUnavailableException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
