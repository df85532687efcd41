package com.rms.relay.core.error;

/**
 * JetStream answered the publish with an API error instead of an ack. Retryable up to the
 * publisher's budget.
 */
public class SendRejectedException extends RelayException {

    private final int apiErrorCode;

    public SendRejectedException(String message, int apiErrorCode, Throwable cause) {
        super(message, cause, true);
        this.apiErrorCode = apiErrorCode;
    }

    public int getApiErrorCode() {
        return apiErrorCode;
    }
}
