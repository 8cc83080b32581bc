package com.ivamare.eventbroker.health;

import com.ivamare.eventbroker.broker.Broker;
import com.ivamare.eventbroker.model.BrokerHealthStats;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;

/**
 * Health indicator for the Event Broker.
 *
 * <p>Maps {@link Broker#healthStats()}: healthy is UP, degraded is reported as
 * {@code DEGRADED}, unhealthy is DOWN. Message counts, streams, consumer groups
 * and configuration are exposed as details.
 */
public class BrokerHealthIndicator implements HealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED", "Broker reachable but reporting problems");

    private final Broker broker;

    public BrokerHealthIndicator(Broker broker) {
        this.broker = broker;
    }

    @Override
    public Health health() {
        try {
            BrokerHealthStats stats = broker.healthStats();

            Health.Builder builder = switch (stats.status()) {
                case HEALTHY -> Health.up();
                case DEGRADED -> Health.status(DEGRADED);
                case UNHEALTHY -> Health.down();
            };

            return builder
                .withDetail("status", stats.status().getValue())
                .withDetail("connected", stats.connected())
                .withDetail("lastPingMs", stats.lastPingMs())
                .withDetail("uptimeSeconds", stats.uptimeSeconds())
                .withDetails(stats.details())
                .build();

        } catch (Exception e) {
            return Health.down()
                .withDetail("error", String.valueOf(e.getMessage()))
                .build();
        }
    }
}
