package com.ivamare.eventbroker.subscription;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Consumes one stream on behalf of one handler within one consumer group.
 *
 * <p>Example:
 * <pre>
 * Subscription subscription = Subscription.builder()
 *     .broker(broker)
 *     .codec(codec)
 *     .stream("orders")
 *     .handler(new OrderProjector())
 *     .build();
 *
 * subscription.start();
 * // ... later
 * subscription.stop(Duration.ofSeconds(30));
 * </pre>
 */
public interface Subscription {

    /**
     * Iteration budget meaning "poll until stopped".
     */
    long UNBOUNDED = -1;

    /**
     * Initialize and start polling on a dedicated thread.
     */
    void start();

    /**
     * Stop gracefully, letting the current batch finish.
     *
     * @param timeout Maximum time to wait for in-flight messages
     * @return Future that completes when the subscription has stopped
     */
    CompletableFuture<Void> stop(Duration timeout);

    /**
     * Stop immediately without waiting.
     */
    void stopNow();

    /**
     * Check if the subscription is running.
     *
     * @return true if polling and not stopping
     */
    boolean isRunning();

    /**
     * Get the number of messages currently being handled.
     *
     * @return count of in-flight messages
     */
    int inFlightCount();

    /**
     * Stream category consumed by this subscription.
     *
     * @return stream name
     */
    String stream();

    String consumerGroup();

    String consumerName();

    /**
     * Number of messages handled successfully since creation.
     *
     * @return processed count
     */
    long processedCount();

    /**
     * Number of consecutive failed reads; reset by a successful read.
     *
     * @return consecutive read error count
     */
    int consecutiveReadErrors();

    /**
     * Create a new subscription builder.
     *
     * @return new builder instance
     */
    static SubscriptionBuilder builder() {
        return new SubscriptionBuilder();
    }
}
