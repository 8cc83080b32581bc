package com.ivamare.eventbroker.broker;

import com.ivamare.eventbroker.policy.RetryPolicy;

import java.time.Duration;

/**
 * Delivery settings of a broker.
 *
 * @param retryPolicy Redelivery policy for nacked messages
 * @param messageTimeout Lease age after which an unacknowledged message is reclaimed
 * @param enableDlq Whether exhausted and reclaimed messages are kept in a dead-letter queue
 * @param operationStateTtl How long ack/nack idempotency state is remembered
 */
public record BrokerSettings(
    RetryPolicy retryPolicy,
    Duration messageTimeout,
    boolean enableDlq,
    Duration operationStateTtl
) {
    public BrokerSettings {
        if (retryPolicy == null) {
            retryPolicy = RetryPolicy.defaultPolicy();
        }
        if (messageTimeout == null || messageTimeout.isNegative() || messageTimeout.isZero()) {
            throw new IllegalArgumentException("messageTimeout must be positive");
        }
        if (operationStateTtl == null || operationStateTtl.isNegative()) {
            throw new IllegalArgumentException("operationStateTtl must not be negative");
        }
    }

    /**
     * Defaults: 3 retries starting at 1 second, 5 minute lease timeout, DLQ enabled,
     * 5 minute idempotency window.
     *
     * @return default settings
     */
    public static BrokerSettings defaults() {
        return new BrokerSettings(RetryPolicy.defaultPolicy(), Duration.ofMinutes(5), true, Duration.ofMinutes(5));
    }

    public BrokerSettings withRetryPolicy(RetryPolicy policy) {
        return new BrokerSettings(policy, messageTimeout, enableDlq, operationStateTtl);
    }

    public BrokerSettings withEnableDlq(boolean enabled) {
        return new BrokerSettings(retryPolicy, messageTimeout, enabled, operationStateTtl);
    }

    public BrokerSettings withMessageTimeout(Duration timeout) {
        return new BrokerSettings(retryPolicy, timeout, enableDlq, operationStateTtl);
    }
}
