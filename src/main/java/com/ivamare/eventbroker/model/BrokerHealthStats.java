package com.ivamare.eventbroker.model;

import java.util.Map;

/**
 * Snapshot of broker health.
 *
 * @param status Overall status
 * @param connected Whether the last ping succeeded
 * @param lastPingMs Duration of the last ping in milliseconds
 * @param uptimeSeconds Seconds since the broker was created
 * @param details Backend specific details (message counts, streams, groups, configuration)
 */
public record BrokerHealthStats(
    BrokerHealthStatus status,
    boolean connected,
    double lastPingMs,
    double uptimeSeconds,
    Map<String, Object> details
) {
    public BrokerHealthStats {
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public boolean isHealthy() {
        return status == BrokerHealthStatus.HEALTHY;
    }
}
