package com.ivamare.eventbroker.model;

import java.util.Map;

/**
 * A raw record delivered by a broker.
 *
 * @param identifier Broker assigned message id (UUID string)
 * @param payload Opaque message payload
 */
public record BrokerMessage(
    String identifier,
    Map<String, Object> payload
) {}
