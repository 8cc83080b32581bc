package com.ivamare.eventbroker.subscription;

/**
 * Naming rules for derived streams.
 *
 * <ul>
 *   <li>{@code <stream>:dlq} - dead-letter stream</li>
 *   <li>{@code <stream>:<suffix>} - backfill lane</li>
 *   <li>{@code <stream>:<suffix>:dlq} - dead-letter stream of the backfill lane</li>
 * </ul>
 */
public final class StreamNames {

    public static final String SEPARATOR = ":";
    public static final String DLQ_SUFFIX = "dlq";

    private StreamNames() {
    }

    /**
     * Dead-letter stream of a stream.
     *
     * @param stream Stream name
     * @return {@code <stream>:dlq}
     */
    public static String dlq(String stream) {
        return stream + SEPARATOR + DLQ_SUFFIX;
    }

    /**
     * Backfill lane of a stream.
     *
     * @param stream Stream name
     * @param suffix Backfill suffix
     * @return {@code <stream>:<suffix>}
     */
    public static String backfill(String stream, String suffix) {
        return stream + SEPARATOR + suffix;
    }

    /**
     * Dead-letter stream of a backfill lane.
     *
     * @param stream Stream name
     * @param suffix Backfill suffix
     * @return {@code <stream>:<suffix>:dlq}
     */
    public static String backfillDlq(String stream, String suffix) {
        return dlq(backfill(stream, suffix));
    }

    /**
     * Check whether a stream name denotes a dead-letter stream.
     *
     * @param stream Stream name
     * @return true if the name ends with {@code :dlq}
     */
    public static boolean isDlq(String stream) {
        return stream != null && stream.endsWith(SEPARATOR + DLQ_SUFFIX);
    }
}
