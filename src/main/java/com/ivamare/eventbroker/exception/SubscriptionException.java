package com.ivamare.eventbroker.exception;

/**
 * Thrown when a subscription cannot be built or initialized.
 */
public class SubscriptionException extends EventBrokerException {

    public SubscriptionException(String message) {
        super(message);
    }

    public SubscriptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
