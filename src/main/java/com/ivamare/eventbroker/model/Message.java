package com.ivamare.eventbroker.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * A structured domain message: body plus metadata.
 *
 * @param data Message body
 * @param metadata Message metadata
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Message(
    @JsonProperty("data") Map<String, Object> data,
    @JsonProperty("metadata") Metadata metadata
) {
    public Message {
        data = data != null ? data : Map.of();
    }

    @JsonIgnore
    public String id() {
        return metadata != null && metadata.headers() != null ? metadata.headers().id() : null;
    }

    @JsonIgnore
    public String type() {
        return metadata != null && metadata.headers() != null ? metadata.headers().type() : null;
    }

    /**
     * Priority from domain metadata, {@link Priority#NORMAL} when absent.
     *
     * @return the effective priority
     */
    @JsonIgnore
    public int priority() {
        return metadata != null && metadata.domain() != null
            ? metadata.domain().effectivePriority()
            : Priority.NORMAL.getValue();
    }
}
