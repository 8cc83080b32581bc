package com.ivamare.eventbroker.model;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Per consumer group view returned by {@code Broker.info()}.
 *
 * @param name Group name
 * @param consumers Consumer names seen reading with this group
 * @param createdAt When the group was registered
 * @param inFlightMessages Leased message count per stream
 * @param failedMessages Retry-queued message count per stream
 * @param dlqMessages Dead-lettered message count per stream
 */
public record ConsumerGroupInfo(
    String name,
    Set<String> consumers,
    Instant createdAt,
    Map<String, Integer> inFlightMessages,
    Map<String, Integer> failedMessages,
    Map<String, Integer> dlqMessages
) {
    public ConsumerGroupInfo {
        consumers = Set.copyOf(consumers);
        inFlightMessages = Map.copyOf(inFlightMessages);
        failedMessages = Map.copyOf(failedMessages);
        dlqMessages = Map.copyOf(dlqMessages);
    }
}
