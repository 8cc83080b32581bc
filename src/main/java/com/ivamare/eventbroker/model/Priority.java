package com.ivamare.eventbroker.model;

/**
 * Well known message priority levels. Any integer is a valid priority; these are named anchors.
 */
public enum Priority {
    BULK(-100),
    LOW(-50),
    NORMAL(0),
    HIGH(50),
    CRITICAL(100);

    private final int value;

    Priority(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }
}
