package com.ivamare.eventbroker.model;

/**
 * Kind of a domain message.
 */
public enum MessageKind {
    EVENT("EVENT"),
    COMMAND("COMMAND"),
    READ_POSITION("READ_POSITION");

    private final String value;

    MessageKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Check whether messages of this kind can be handed to a handler.
     *
     * @return true for events and commands
     */
    public boolean isDispatchable() {
        return this == EVENT || this == COMMAND;
    }

    /**
     * Parse from string value.
     *
     * @param value the string value
     * @return the kind, or null if the value is not a known kind
     */
    public static MessageKind fromValue(String value) {
        for (MessageKind kind : values()) {
            if (kind.value.equals(value)) {
                return kind;
            }
        }
        return null;
    }
}
