package com.rms.relay.core.error;

/**
 * Reading the source failed after the reader's own retries. Aborts the cycle before any publish.
 */
public class SourceUnavailableException extends RelayException {

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
