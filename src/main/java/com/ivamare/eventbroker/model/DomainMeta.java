package com.ivamare.eventbroker.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Domain level metadata of a message.
 *
 * @param fqn Fully qualified name of the event or command class
 * @param kind {@code EVENT} or {@code COMMAND}
 * @param originStream Stream of the message that caused this one
 * @param streamCategory Stream category the message belongs to
 * @param version Message schema version
 * @param sequenceId Sequence of the event in its aggregate
 * @param asynchronous Whether the message is processed asynchronously
 * @param expectedVersion Stream version expected when written
 * @param priority Processing priority, null means {@link Priority#NORMAL}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DomainMeta(
    @JsonProperty("fqn") String fqn,
    @JsonProperty("kind") String kind,
    @JsonProperty("origin_stream") String originStream,
    @JsonProperty("stream_category") String streamCategory,
    @JsonProperty("version") String version,
    @JsonProperty("sequence_id") String sequenceId,
    @JsonProperty("asynchronous") Boolean asynchronous,
    @JsonProperty("expected_version") Integer expectedVersion,
    @JsonProperty("priority") Integer priority
) {
    public DomainMeta {
        if (version == null) {
            version = "v1";
        }
        if (asynchronous == null) {
            asynchronous = Boolean.TRUE;
        }
    }

    /**
     * Create minimal domain metadata for a message kind.
     *
     * @param fqn Fully qualified class name
     * @param kind Message kind
     * @param streamCategory Stream category
     * @param priority Priority (null for normal)
     * @return the metadata
     */
    public static DomainMeta of(String fqn, MessageKind kind, String streamCategory, Integer priority) {
        return new DomainMeta(fqn, kind.getValue(), null, streamCategory, "v1", null, true, null, priority);
    }

    @JsonIgnore
    public MessageKind messageKind() {
        return MessageKind.fromValue(kind);
    }

    /**
     * Priority with absent treated as {@link Priority#NORMAL}.
     *
     * @return the effective priority
     */
    @JsonIgnore
    public int effectivePriority() {
        return priority != null ? priority : Priority.NORMAL.getValue();
    }
}
