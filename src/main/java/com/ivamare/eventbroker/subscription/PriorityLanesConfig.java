package com.ivamare.eventbroker.subscription;

import com.ivamare.eventbroker.exception.ConfigurationException;

import java.util.Map;

/**
 * Priority lane settings.
 *
 * <p>When enabled, messages with a priority below {@code threshold} are routed
 * to the backfill lane {@code <stream>:<backfillSuffix>}, and subscriptions drain
 * the primary lane before the backfill lane.
 *
 * @param enabled Whether lanes are enabled
 * @param threshold Priorities strictly below this go to the backfill lane
 * @param backfillSuffix Suffix of the backfill lane
 */
public record PriorityLanesConfig(
    boolean enabled,
    int threshold,
    String backfillSuffix
) {
    public static final String DEFAULT_BACKFILL_SUFFIX = "backfill";

    public PriorityLanesConfig {
        if (backfillSuffix == null || backfillSuffix.isBlank()) {
            throw new ConfigurationException("priority_lanes.backfill_suffix must be a non-empty string");
        }
    }

    /**
     * Lanes disabled, threshold 0, suffix {@code backfill}.
     *
     * @return default config
     */
    public static PriorityLanesConfig disabled() {
        return new PriorityLanesConfig(false, 0, DEFAULT_BACKFILL_SUFFIX);
    }

    /**
     * Build from loosely typed configuration values, validating types eagerly.
     *
     * <p>Recognised keys: {@code enabled} (Boolean), {@code threshold} (Integer or Long,
     * never Boolean), {@code backfill_suffix} (non-blank String). Missing keys take defaults.
     *
     * @param raw raw values, may be null
     * @return the config
     * @throws ConfigurationException if a value has the wrong type
     */
    public static PriorityLanesConfig fromMap(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return disabled();
        }

        boolean enabled = false;
        Object rawEnabled = raw.get("enabled");
        if (rawEnabled != null) {
            if (!(rawEnabled instanceof Boolean flag)) {
                throw new ConfigurationException(
                    "priority_lanes.enabled must be a boolean, got " + typeName(rawEnabled));
            }
            enabled = flag;
        }

        int threshold = 0;
        Object rawThreshold = raw.get("threshold");
        if (rawThreshold != null) {
            if (rawThreshold instanceof Integer value) {
                threshold = value;
            } else if (rawThreshold instanceof Long value
                && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                threshold = value.intValue();
            } else {
                throw new ConfigurationException(
                    "priority_lanes.threshold must be an integer, got " + typeName(rawThreshold));
            }
        }

        String suffix = DEFAULT_BACKFILL_SUFFIX;
        if (raw.containsKey("backfill_suffix")) {
            Object rawSuffix = raw.get("backfill_suffix");
            if (!(rawSuffix instanceof String text) || text.isBlank()) {
                throw new ConfigurationException(
                    "priority_lanes.backfill_suffix must be a non-empty string, got " + typeName(rawSuffix));
            }
            suffix = text;
        }

        return new PriorityLanesConfig(enabled, threshold, suffix);
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
