package com.ivamare.eventbroker.exception;

/**
 * Raised by a broker backend when its underlying connection is unavailable.
 *
 * <p>Always classified as a connection error by {@link ConnectionExceptionClassifier},
 * so broker operations get one reconnect-and-retry cycle.
 */
public class BrokerConnectionException extends EventBrokerException {

    public BrokerConnectionException(String message) {
        super(message);
    }

    public BrokerConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
