package com.ivamare.eventbroker.model;

/**
 * Overall broker health as reported by {@code healthStats()}.
 */
public enum BrokerHealthStatus {
    HEALTHY("healthy"),
    DEGRADED("degraded"),
    UNHEALTHY("unhealthy");

    private final String value;

    BrokerHealthStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static BrokerHealthStatus fromValue(String value) {
        for (BrokerHealthStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown health status: " + value);
    }
}
