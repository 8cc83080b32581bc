package com.ivamare.eventbroker.broker;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable bit set of {@link BrokerCapability} values.
 *
 * @param bits the raw bit mask
 */
public record BrokerCapabilities(long bits) {

    public static final BrokerCapabilities NONE = new BrokerCapabilities(0L);

    /**
     * Build a set from individual capabilities.
     *
     * @param capabilities capabilities to include
     * @return the capability set
     */
    public static BrokerCapabilities of(BrokerCapability... capabilities) {
        long bits = 0L;
        for (BrokerCapability capability : capabilities) {
            bits |= capability.mask();
        }
        return new BrokerCapabilities(bits);
    }

    /**
     * Build a set from a collection of capabilities.
     *
     * @param capabilities capabilities to include
     * @return the capability set
     */
    public static BrokerCapabilities of(Collection<BrokerCapability> capabilities) {
        return of(capabilities.toArray(new BrokerCapability[0]));
    }

    public BrokerCapabilities with(BrokerCapability... capabilities) {
        return new BrokerCapabilities(bits | of(capabilities).bits);
    }

    public BrokerCapabilities with(BrokerCapabilities other) {
        return new BrokerCapabilities(bits | other.bits);
    }

    public BrokerCapabilities without(BrokerCapability capability) {
        return new BrokerCapabilities(bits & ~capability.mask());
    }

    public boolean contains(BrokerCapability capability) {
        return (bits & capability.mask()) != 0;
    }

    /**
     * Check that every capability of {@code required} is present.
     *
     * @param required required capabilities
     * @return true if this set is a superset of required
     */
    public boolean containsAll(BrokerCapabilities required) {
        return (bits & required.bits) == required.bits;
    }

    /**
     * Check that at least one capability of {@code candidates} is present.
     *
     * @param candidates candidate capabilities
     * @return true if the sets intersect
     */
    public boolean containsAny(BrokerCapabilities candidates) {
        return (bits & candidates.bits) != 0;
    }

    public boolean isEmpty() {
        return bits == 0L;
    }

    /**
     * Expand to the individual capabilities.
     *
     * @return the capabilities present, in declaration order
     */
    public Set<BrokerCapability> toSet() {
        EnumSet<BrokerCapability> set = EnumSet.noneOf(BrokerCapability.class);
        for (BrokerCapability capability : BrokerCapability.values()) {
            if (contains(capability)) {
                set.add(capability);
            }
        }
        return set;
    }

    @Override
    public String toString() {
        return "BrokerCapabilities" + toSet();
    }
}
