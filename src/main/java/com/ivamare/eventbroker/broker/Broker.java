package com.ivamare.eventbroker.broker;

import com.ivamare.eventbroker.model.BrokerHealthStats;
import com.ivamare.eventbroker.model.BrokerInfo;
import com.ivamare.eventbroker.model.BrokerMessage;
import com.ivamare.eventbroker.model.DeadLetterEntry;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Message broker delivering stream messages to independent consumer groups
 * with at-least-once semantics.
 *
 * <p>Every consumer group sees every message of a stream. A message read by a
 * group stays leased to that group until it is acknowledged, negatively
 * acknowledged, or reclaimed as stale.
 *
 * <p>Example:
 * <pre>
 * String id = broker.publish("orders", Map.of("orderId", 42));
 *
 * broker.getNext("orders", "billing").ifPresent(message -&gt; {
 *     try {
 *         bill(message.payload());
 *         broker.ack("orders", message.identifier(), "billing");
 *     } catch (Exception e) {
 *         broker.nack("orders", message.identifier(), "billing");
 *     }
 * });
 * </pre>
 *
 * <p>Precondition failures (unknown group, foreign message, wrong state) are
 * reported as {@code false} or an empty result, never as exceptions.
 */
public interface Broker {

    /**
     * Append a message to a stream.
     *
     * @param stream Stream name
     * @param payload Message payload; the broker stores its own copy
     * @return Broker assigned message identifier
     * @throws IllegalArgumentException if stream is blank or payload is null
     */
    String publish(String stream, Map<String, Object> payload);

    /**
     * Lease the next available message of a stream to a consumer group.
     *
     * <p>Registers the group if needed and redelivers due retries first.
     *
     * @param stream Stream name
     * @param consumerGroup Consumer group name
     * @return the message, or empty if nothing is available
     */
    Optional<BrokerMessage> getNext(String stream, String consumerGroup);

    /**
     * Read up to {@code count} messages without waiting.
     *
     * @param stream Stream name
     * @param consumerGroup Consumer group name
     * @param count Maximum number of messages
     * @return leased messages, possibly empty
     */
    List<BrokerMessage> read(String stream, String consumerGroup, int count);

    /**
     * Read up to {@code count} messages, waiting at most {@code timeout} for the first one.
     *
     * @param stream Stream name
     * @param consumerGroup Consumer group name
     * @param consumerName Name of the reading consumer
     * @param timeout Maximum time to wait; zero means do not wait
     * @param count Maximum number of messages
     * @return leased messages, empty on timeout
     */
    List<BrokerMessage> readBlocking(String stream, String consumerGroup, String consumerName,
                                     Duration timeout, int count);

    /**
     * Acknowledge successful processing.
     *
     * @param stream Stream name
     * @param identifier Message identifier
     * @param consumerGroup Consumer group name
     * @return true if the message was in flight or awaiting retry for this group
     */
    boolean ack(String stream, String identifier, String consumerGroup);

    /**
     * Report failed processing. The message is scheduled for redelivery with
     * backoff, or dead-lettered once retries are exhausted.
     *
     * @param stream Stream name
     * @param identifier Message identifier
     * @param consumerGroup Consumer group name
     * @return true if the message was in flight for this group
     */
    boolean nack(String stream, String identifier, String consumerGroup);

    /**
     * Register a consumer group on a stream, positioned at the stream start.
     *
     * @param consumerGroup Consumer group name
     * @param stream Stream name
     */
    void ensureGroup(String consumerGroup, String stream);

    /**
     * Check the connection and re-establish it if needed.
     *
     * @return true if the broker is usable
     */
    boolean ensureConnection();

    /**
     * Probe the backend and record the probe's duration and outcome.
     *
     * @return true if the probe succeeded
     */
    boolean ping();

    /**
     * Health snapshot including message counts and configuration.
     *
     * @return health stats
     */
    BrokerHealthStats healthStats();

    /**
     * Consumer group introspection.
     *
     * @return broker info
     */
    BrokerInfo info();

    /**
     * Dead-lettered messages of a consumer group.
     *
     * @param consumerGroup Consumer group name
     * @param stream Stream to filter on, or null for all streams
     * @return entries by stream; a requested stream is present even when it has no entries
     */
    Map<String, List<DeadLetterEntry>> getDlqMessages(String consumerGroup, String stream);

    /**
     * Move a dead-lettered message back to the live path of its consumer group.
     *
     * @param identifier Message identifier
     * @param consumerGroup Consumer group name
     * @param stream Stream name
     * @return true if the entry was found and re-inserted
     */
    boolean reprocessDlqMessage(String identifier, String consumerGroup, String stream);

    /**
     * Capabilities supported by this broker.
     *
     * @return capability set
     */
    BrokerCapabilities capabilities();

    default boolean hasCapability(BrokerCapability capability) {
        return capabilities().contains(capability);
    }

    default boolean hasAllCapabilities(BrokerCapabilities required) {
        return capabilities().containsAll(required);
    }

    default boolean hasAnyCapability(BrokerCapabilities candidates) {
        return capabilities().containsAny(candidates);
    }
}
