package com.ivamare.eventbroker.health;

import com.ivamare.eventbroker.subscription.Subscription;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Health indicator for Event Broker subscriptions.
 *
 * <p>Reports:
 * <ul>
 *   <li>Status of each subscription by consumer group</li>
 *   <li>In-flight and processed message counts</li>
 *   <li>Overall health based on subscription status</li>
 * </ul>
 */
public class SubscriptionHealthIndicator implements HealthIndicator {

    static final int MAX_CONSECUTIVE_READ_ERRORS = 5;

    private final List<Subscription> subscriptions;

    public SubscriptionHealthIndicator(List<Subscription> subscriptions) {
        this.subscriptions = subscriptions != null ? subscriptions : List.of();
    }

    @Override
    public Health health() {
        if (subscriptions.isEmpty()) {
            return Health.unknown()
                .withDetail("message", "No subscriptions registered")
                .build();
        }

        Map<String, SubscriptionStatus> statuses = subscriptions.stream()
            .collect(Collectors.toMap(
                s -> s.consumerGroup() + "@" + s.stream(),
                s -> new SubscriptionStatus(s.isRunning(), s.inFlightCount(),
                    s.processedCount(), s.consecutiveReadErrors()),
                (existing, replacement) -> existing
            ));

        boolean allRunning = subscriptions.stream().allMatch(Subscription::isRunning);
        int totalInFlight = subscriptions.stream().mapToInt(Subscription::inFlightCount).sum();
        int maxConsecutiveErrors = subscriptions.stream()
            .mapToInt(Subscription::consecutiveReadErrors)
            .max()
            .orElse(0);

        // Consider unhealthy if any subscription keeps failing to read
        boolean healthy = allRunning && maxConsecutiveErrors < MAX_CONSECUTIVE_READ_ERRORS;
        Health.Builder builder = healthy ? Health.up() : Health.down();

        return builder
            .withDetail("subscriptions", statuses)
            .withDetail("totalInFlight", totalInFlight)
            .withDetail("maxConsecutiveErrors", maxConsecutiveErrors)
            .build();
    }

    record SubscriptionStatus(boolean running, int inFlight, long processed, int consecutiveErrors) {}
}
