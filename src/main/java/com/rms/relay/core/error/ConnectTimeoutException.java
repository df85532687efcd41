package com.rms.relay.core.error;

/**
 * The NATS connection could not be established within the connect retry budget. Fails publisher
 * construction (and with it application startup); never reported per message.
 */
public class ConnectTimeoutException extends RelayException {

    public ConnectTimeoutException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
