package com.ivamare.eventbroker.model;

/**
 * Idempotency state of a message within a consumer group.
 */
public enum OperationState {
    PENDING("pending"),
    ACKNOWLEDGED("acknowledged"),
    NACKED("nacked");

    private final String value;

    OperationState(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static OperationState fromValue(String value) {
        for (OperationState state : values()) {
            if (state.value.equals(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown operation state: " + value);
    }
}
