package com.ivamare.eventbroker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Message metadata.
 *
 * @param headers Message headers
 * @param envelope Integrity envelope
 * @param domain Domain metadata
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Metadata(
    @JsonProperty("headers") MessageHeaders headers,
    @JsonProperty("envelope") MessageEnvelope envelope,
    @JsonProperty("domain") DomainMeta domain
) {
    public Metadata {
        if (envelope == null) {
            envelope = new MessageEnvelope(MessageEnvelope.SPEC_VERSION, null);
        }
    }
}
