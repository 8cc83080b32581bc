package com.ivamare.eventbroker.broker;

/**
 * A single feature a broker backend may support.
 *
 * <p>Each capability occupies one bit in a {@link BrokerCapabilities} set.
 */
public enum BrokerCapability {
    PUBLISH("publish"),
    SUBSCRIBE("subscribe"),
    CONSUMER_GROUPS("consumer_groups"),
    ACK_NACK("ack_nack"),
    DELIVERY_GUARANTEES("delivery_guarantees"),
    MESSAGE_ORDERING("message_ordering"),
    BLOCKING_READ("blocking_read"),
    DEAD_LETTER_QUEUE("dead_letter_queue"),
    REPLAY("replay"),
    STREAM_PARTITIONING("stream_partitioning");

    private final String value;

    BrokerCapability(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Bit mask of this capability.
     *
     * @return a long with exactly one bit set
     */
    public long mask() {
        return 1L << ordinal();
    }

    /**
     * Parse from string value.
     *
     * @param value the string value
     * @return the capability
     * @throws IllegalArgumentException if the value is unknown
     */
    public static BrokerCapability fromValue(String value) {
        for (BrokerCapability capability : values()) {
            if (capability.value.equals(value)) {
                return capability;
            }
        }
        throw new IllegalArgumentException("Unknown broker capability: " + value);
    }
}
