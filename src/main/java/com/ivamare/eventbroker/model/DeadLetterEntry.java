package com.ivamare.eventbroker.model;

import java.time.Instant;
import java.util.Map;

/**
 * A message parked in a consumer group's dead-letter queue.
 *
 * @param identifier Message id
 * @param payload Message payload
 * @param reason Why the message was dead-lettered ({@link #REASON_MAX_RETRIES} or {@link #REASON_TIMEOUT})
 * @param failedAt When the message was dead-lettered
 */
public record DeadLetterEntry(
    String identifier,
    Map<String, Object> payload,
    String reason,
    Instant failedAt
) {
    public static final String REASON_MAX_RETRIES = "max_retries_exceeded";
    public static final String REASON_TIMEOUT = "timeout";
}
