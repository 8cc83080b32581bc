package com.ivamare.eventbroker.model;

import java.util.Map;

/**
 * Broker introspection data.
 *
 * @param consumerGroups Consumer groups by name
 */
public record BrokerInfo(
    Map<String, ConsumerGroupInfo> consumerGroups
) {
    public BrokerInfo {
        consumerGroups = Map.copyOf(consumerGroups);
    }
}
