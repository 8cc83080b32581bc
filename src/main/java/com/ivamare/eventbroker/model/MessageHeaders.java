package com.ivamare.eventbroker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Structured message headers.
 *
 * @param id Message id
 * @param time Time of message generation
 * @param type Registered message type name, for example {@code Shop.OrderPlaced.v1}
 * @param stream Stream the message is written to
 * @param idempotencyKey Caller provided deduplication key
 * @param traceparent Trace context
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MessageHeaders(
    @JsonProperty("id") String id,
    @JsonProperty("time") Instant time,
    @JsonProperty("type") String type,
    @JsonProperty("stream") String stream,
    @JsonProperty("idempotency_key") String idempotencyKey,
    @JsonProperty("traceparent") TraceParent traceparent
) {}
