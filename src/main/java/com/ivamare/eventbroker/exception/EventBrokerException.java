package com.ivamare.eventbroker.exception;

/**
 * Base exception for all Event Broker errors.
 */
public class EventBrokerException extends RuntimeException {

    public EventBrokerException(String message) {
        super(message);
    }

    public EventBrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
