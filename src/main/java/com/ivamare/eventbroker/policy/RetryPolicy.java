package com.ivamare.eventbroker.policy;

import java.time.Duration;

/**
 * Broker side redelivery policy for nacked messages.
 *
 * @param maxRetries Number of nacks that still lead to redelivery; the next one dead-letters
 * @param retryDelay Base delay before the first redelivery
 * @param backoffMultiplier Factor applied to the delay for each further retry
 */
public record RetryPolicy(
    int maxRetries,
    Duration retryDelay,
    double backoffMultiplier
) {
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        if (retryDelay == null || retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must be a non-negative duration");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0, got " + backoffMultiplier);
        }
    }

    /**
     * Default retry policy: 3 retries, 1 second base delay, doubling.
     *
     * @return Default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(3, Duration.ofSeconds(1), DEFAULT_BACKOFF_MULTIPLIER);
    }

    /**
     * Create a policy where the first nack dead-letters.
     *
     * @return No retry policy
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(0, Duration.ZERO, DEFAULT_BACKOFF_MULTIPLIER);
    }

    /**
     * Get the delay before redelivery after the given nack.
     *
     * @param retryCount Nack count including this one (1-based)
     * @return {@code retryDelay * backoffMultiplier^(retryCount-1)}
     */
    public Duration backoffFor(int retryCount) {
        int exponent = Math.max(0, retryCount - 1);
        double millis = retryDelay.toMillis() * Math.pow(backoffMultiplier, exponent);
        if (millis >= Long.MAX_VALUE) {
            return Duration.ofMillis(Long.MAX_VALUE);
        }
        return Duration.ofMillis(Math.round(millis));
    }

    /**
     * Check if the message should be redelivered after the given nack.
     *
     * @param retryCount Nack count including this one (1-based)
     * @return true while retryCount &lt;= maxRetries
     */
    public boolean shouldRetry(int retryCount) {
        return retryCount <= maxRetries;
    }
}
