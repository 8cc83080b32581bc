package com.ivamare.eventbroker.broker;

import static com.ivamare.eventbroker.broker.BrokerCapability.*;

/**
 * Named capability tiers. Each tier is a strict superset of the previous one.
 */
public enum CapabilityTier {
    BASIC_PUBSUB(BrokerCapabilities.of(PUBLISH, SUBSCRIBE)),
    SIMPLE_QUEUING(BASIC_PUBSUB.capabilities.with(CONSUMER_GROUPS)),
    RELIABLE_MESSAGING(SIMPLE_QUEUING.capabilities.with(ACK_NACK, DELIVERY_GUARANTEES)),
    ORDERED_MESSAGING(RELIABLE_MESSAGING.capabilities.with(MESSAGE_ORDERING)),
    ENTERPRISE_STREAMING(ORDERED_MESSAGING.capabilities.with(
        BLOCKING_READ, DEAD_LETTER_QUEUE, REPLAY, STREAM_PARTITIONING));

    private final BrokerCapabilities capabilities;

    CapabilityTier(BrokerCapabilities capabilities) {
        this.capabilities = capabilities;
    }

    public BrokerCapabilities capabilities() {
        return capabilities;
    }

    /**
     * Highest tier fully covered by the given capability set.
     *
     * @param capabilities capabilities to test
     * @return the tier, or null if not even basic pub/sub is supported
     */
    public static CapabilityTier highestSupportedBy(BrokerCapabilities capabilities) {
        CapabilityTier result = null;
        for (CapabilityTier tier : values()) {
            if (capabilities.containsAll(tier.capabilities)) {
                result = tier;
            }
        }
        return result;
    }
}
