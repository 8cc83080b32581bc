package com.ivamare.eventbroker.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * W3C trace context carried in message headers.
 *
 * <p>Wire format: {@code 00-<trace_id>-<parent_id>-<flags>}.
 *
 * @param traceId Trace id (used as correlation id)
 * @param parentId Parent span id (used as causation id)
 * @param sampled Whether the trace is sampled
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TraceParent(
    @JsonProperty("trace_id") String traceId,
    @JsonProperty("parent_id") String parentId,
    @JsonProperty("sampled") boolean sampled
) {
    /**
     * Parse a W3C traceparent header.
     *
     * @param header header value
     * @return the parsed trace context, or null if the header is malformed
     */
    public static TraceParent parse(String header) {
        if (header == null) {
            return null;
        }
        String[] parts = header.split("-");
        if (parts.length != 4 || !"00".equals(parts[0])) {
            return null;
        }
        return new TraceParent(parts[1], parts[2], "01".equals(parts[3]));
    }

    public String toW3c() {
        return "00-" + traceId + "-" + parentId + "-" + (sampled ? "01" : "00");
    }

    @JsonIgnore
    public String correlationId() {
        return traceId;
    }

    @JsonIgnore
    public String causationId() {
        return parentId;
    }
}
