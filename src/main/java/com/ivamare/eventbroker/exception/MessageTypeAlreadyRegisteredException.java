package com.ivamare.eventbroker.exception;

/**
 * Thrown when attempting to register a message type name that is already bound to another class.
 */
public class MessageTypeAlreadyRegisteredException extends EventBrokerException {

    private final String typeName;

    public MessageTypeAlreadyRegisteredException(String typeName, Class<?> existing) {
        super("Message type " + typeName + " already registered to " + existing.getName());
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
