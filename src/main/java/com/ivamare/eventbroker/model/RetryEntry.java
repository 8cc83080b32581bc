package com.ivamare.eventbroker.model;

import java.time.Instant;
import java.util.Map;

/**
 * A nacked message waiting for redelivery.
 *
 * @param identifier Message id
 * @param payload Message payload
 * @param retryCount Number of nacks so far
 * @param nextRetryAt Earliest redelivery time
 */
public record RetryEntry(
    String identifier,
    Map<String, Object> payload,
    int retryCount,
    Instant nextRetryAt
) {
    /**
     * Check whether the entry may be redelivered.
     *
     * @param now current time
     * @return true once nextRetryAt has passed
     */
    public boolean isDue(Instant now) {
        return !nextRetryAt.isAfter(now);
    }
}
