package com.ivamare.eventbroker.exception;

import java.util.Map;

/**
 * Thrown when a raw broker payload cannot be turned into a domain message.
 *
 * <p>Carries the broker message id and a context map describing the failure
 * (stream, consumer group, missing field, expected and actual checksum, ...).
 */
public class DeserializationException extends EventBrokerException {

    private final String messageId;
    private final Map<String, Object> context;

    public DeserializationException(String messageId, String message, Map<String, Object> context) {
        this(messageId, message, context, null);
    }

    public DeserializationException(String messageId, String message, Map<String, Object> context,
                                    Throwable cause) {
        super(message, cause);
        this.messageId = messageId;
        this.context = context != null ? Map.copyOf(context) : Map.of();
    }

    public String getMessageId() {
        return messageId;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
