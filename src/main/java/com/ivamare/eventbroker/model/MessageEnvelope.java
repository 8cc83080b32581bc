package com.ivamare.eventbroker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Integrity and versioning envelope.
 *
 * @param specversion Envelope format version
 * @param checksum SHA-256 hex digest of the canonical JSON of the message data
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MessageEnvelope(
    @JsonProperty("specversion") String specversion,
    @JsonProperty("checksum") String checksum
) {
    public static final String SPEC_VERSION = "1.0";

    public MessageEnvelope {
        if (specversion == null || specversion.isBlank()) {
            specversion = SPEC_VERSION;
        }
    }

    public static MessageEnvelope withChecksum(String checksum) {
        return new MessageEnvelope(SPEC_VERSION, checksum);
    }

    public boolean hasChecksum() {
        return checksum != null && !checksum.isEmpty();
    }
}
