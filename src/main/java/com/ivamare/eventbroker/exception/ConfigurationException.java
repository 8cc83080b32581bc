package com.ivamare.eventbroker.exception;

/**
 * Thrown when broker or subscription configuration holds an invalid value.
 */
public class ConfigurationException extends EventBrokerException {

    public ConfigurationException(String message) {
        super(message);
    }
}
