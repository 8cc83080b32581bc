package com.ivamare.eventbroker;

import com.ivamare.eventbroker.broker.BrokerSettings;
import com.ivamare.eventbroker.exception.ConfigurationException;
import com.ivamare.eventbroker.policy.RetryPolicy;
import com.ivamare.eventbroker.subscription.PriorityLanesConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for Event Broker.
 *
 * <p>Example configuration:
 * <pre>
 * eventbroker:
 *   enabled: true
 *   broker:
 *     max-retries: 3
 *     retry-delay: 1s
 *     backoff-multiplier: 2.0
 *     message-timeout: 300s
 *     enable-dlq: true
 *     operation-state-ttl: 300s
 *     stale-sweep-interval: 0s
 *   subscription:
 *     auto-start: false
 *     messages-per-tick: 10
 *     blocking-timeout: 5s
 *     max-retries: 3
 *     enable-dlq: true
 *     backfill-max-wait: 1s
 *     priority-lanes:
 *       enabled: false
 *       threshold: 0
 *       backfill-suffix: backfill
 * </pre>
 */
@ConfigurationProperties(prefix = "eventbroker")
public class EventBrokerProperties {

    /**
     * Enable/disable Event Broker auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Broker delivery configuration.
     */
    private BrokerProperties broker = new BrokerProperties();

    /**
     * Subscription configuration.
     */
    private SubscriptionProperties subscription = new SubscriptionProperties();

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public BrokerProperties getBroker() {
        return broker;
    }

    public void setBroker(BrokerProperties broker) {
        this.broker = broker;
    }

    public SubscriptionProperties getSubscription() {
        return subscription;
    }

    public void setSubscription(SubscriptionProperties subscription) {
        this.subscription = subscription;
    }

    /**
     * Broker delivery configuration.
     */
    public static class BrokerProperties {

        /**
         * Nacks that still lead to redelivery; the next nack dead-letters.
         */
        private int maxRetries = 3;

        /**
         * Base delay before the first redelivery.
         */
        private Duration retryDelay = Duration.ofSeconds(1);

        /**
         * Multiplier applied to the delay for each further retry.
         */
        private double backoffMultiplier = RetryPolicy.DEFAULT_BACKOFF_MULTIPLIER;

        /**
         * Lease age after which an unacknowledged message is reclaimed.
         */
        private Duration messageTimeout = Duration.ofMinutes(5);

        /**
         * Keep exhausted and reclaimed messages in a dead-letter queue.
         */
        private boolean enableDlq = true;

        /**
         * How long ack/nack idempotency state is remembered.
         */
        private Duration operationStateTtl = Duration.ofMinutes(5);

        /**
         * Interval of the background stale-lease sweep. Zero disables it.
         */
        private Duration staleSweepInterval = Duration.ZERO;

        public RetryPolicy toRetryPolicy() {
            return new RetryPolicy(maxRetries, retryDelay, backoffMultiplier);
        }

        public BrokerSettings toSettings() {
            return new BrokerSettings(toRetryPolicy(), messageTimeout, enableDlq, operationStateTtl);
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public Duration getMessageTimeout() {
            return messageTimeout;
        }

        public void setMessageTimeout(Duration messageTimeout) {
            this.messageTimeout = messageTimeout;
        }

        public boolean isEnableDlq() {
            return enableDlq;
        }

        public void setEnableDlq(boolean enableDlq) {
            this.enableDlq = enableDlq;
        }

        public Duration getOperationStateTtl() {
            return operationStateTtl;
        }

        public void setOperationStateTtl(Duration operationStateTtl) {
            this.operationStateTtl = operationStateTtl;
        }

        public Duration getStaleSweepInterval() {
            return staleSweepInterval;
        }

        public void setStaleSweepInterval(Duration staleSweepInterval) {
            this.staleSweepInterval = staleSweepInterval;
        }
    }

    /**
     * Subscription configuration.
     */
    public static class SubscriptionProperties {

        /**
         * Start a subscription for every registered stream handler on application ready.
         */
        private boolean autoStart = false;

        /**
         * Maximum number of messages read per poll.
         */
        private int messagesPerTick = 10;

        /**
         * How long a read waits for messages.
         */
        private Duration blockingTimeout = Duration.ofSeconds(5);

        /**
         * Handler attempts before a message is dead-lettered.
         */
        private int maxRetries = 3;

        /**
         * Publish failed messages to the {@code <stream>:dlq} stream.
         */
        private boolean enableDlq = true;

        /**
         * Cap on the wait of a backfill lane read.
         */
        private Duration backfillMaxWait = Duration.ofSeconds(1);

        /**
         * Priority lane configuration.
         */
        private PriorityLanesProperties priorityLanes = new PriorityLanesProperties();

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public int getMessagesPerTick() {
            return messagesPerTick;
        }

        public void setMessagesPerTick(int messagesPerTick) {
            this.messagesPerTick = messagesPerTick;
        }

        public Duration getBlockingTimeout() {
            return blockingTimeout;
        }

        public void setBlockingTimeout(Duration blockingTimeout) {
            this.blockingTimeout = blockingTimeout;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public boolean isEnableDlq() {
            return enableDlq;
        }

        public void setEnableDlq(boolean enableDlq) {
            this.enableDlq = enableDlq;
        }

        public Duration getBackfillMaxWait() {
            return backfillMaxWait;
        }

        public void setBackfillMaxWait(Duration backfillMaxWait) {
            this.backfillMaxWait = backfillMaxWait;
        }

        public PriorityLanesProperties getPriorityLanes() {
            return priorityLanes;
        }

        public void setPriorityLanes(PriorityLanesProperties priorityLanes) {
            this.priorityLanes = priorityLanes;
        }
    }

    /**
     * Priority lane configuration.
     */
    public static class PriorityLanesProperties {

        /**
         * Whether lanes are enabled. Only {@code true} or {@code false} is accepted.
         */
        private String enabled = "false";

        /**
         * Priorities strictly below this are routed to the backfill lane.
         */
        private int threshold = 0;

        private String backfillSuffix = PriorityLanesConfig.DEFAULT_BACKFILL_SUFFIX;

        /**
         * Validated lane configuration.
         *
         * @return the config
         * @throws ConfigurationException if the flag is not a boolean or the suffix is blank
         */
        public PriorityLanesConfig toConfig() {
            return new PriorityLanesConfig(parseFlag(enabled), threshold, backfillSuffix);
        }

        private static boolean parseFlag(String value) {
            if ("true".equalsIgnoreCase(value)) {
                return true;
            }
            if ("false".equalsIgnoreCase(value)) {
                return false;
            }
            throw new ConfigurationException("priority_lanes.enabled must be a boolean, got '" + value + "'");
        }

        public String getEnabled() {
            return enabled;
        }

        public void setEnabled(String enabled) {
            this.enabled = enabled;
        }

        public int getThreshold() {
            return threshold;
        }

        public void setThreshold(int threshold) {
            this.threshold = threshold;
        }

        public String getBackfillSuffix() {
            return backfillSuffix;
        }

        public void setBackfillSuffix(String backfillSuffix) {
            this.backfillSuffix = backfillSuffix;
        }
    }
}
