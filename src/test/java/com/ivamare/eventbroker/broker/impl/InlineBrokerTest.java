package com.ivamare.eventbroker.broker.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventbroker.MutableClock;
import com.ivamare.eventbroker.broker.BrokerCapability;
import com.ivamare.eventbroker.broker.BrokerSettings;
import com.ivamare.eventbroker.model.BrokerHealthStats;
import com.ivamare.eventbroker.model.BrokerHealthStatus;
import com.ivamare.eventbroker.model.BrokerInfo;
import com.ivamare.eventbroker.model.BrokerMessage;
import com.ivamare.eventbroker.model.ConsumerGroupInfo;
import com.ivamare.eventbroker.model.DeadLetterEntry;
import com.ivamare.eventbroker.model.OperationState;
import com.ivamare.eventbroker.model.RetryEntry;
import com.ivamare.eventbroker.policy.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InlineBroker")
class InlineBrokerTest {

    private static final String STREAM = "orders";
    private static final String GROUP = "projector";

    private MutableClock clock;
    private InlineBroker broker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        broker = new InlineBroker(new ObjectMapper(), BrokerSettings.defaults(), clock);
    }

    private BrokerMessage next(String stream, String group) {
        Optional<BrokerMessage> message = broker.getNext(stream, group);
        assertTrue(message.isPresent(), "expected a message on " + stream);
        return message.get();
    }

    @Nested
    @DisplayName("Publishing and reading")
    class PublishTests {

        @Test
        @DisplayName("should deliver messages in publish order")
        void shouldDeliverInPublishOrder() {
            String first = broker.publish(STREAM, Map.of("n", 1));
            String second = broker.publish(STREAM, Map.of("n", 2));

            assertEquals(first, next(STREAM, GROUP).identifier());
            assertEquals(second, next(STREAM, GROUP).identifier());
            assertTrue(broker.getNext(STREAM, GROUP).isEmpty());
        }

        @Test
        @DisplayName("should assign unique identifiers")
        void shouldAssignUniqueIdentifiers() {
            assertNotEquals(broker.publish(STREAM, Map.of()), broker.publish(STREAM, Map.of()));
        }

        @Test
        @DisplayName("each group should see every message")
        void eachGroupShouldSeeEveryMessage() {
            String id = broker.publish(STREAM, Map.of("n", 1));

            assertEquals(id, next(STREAM, "a").identifier());
            assertEquals(id, next(STREAM, "b").identifier());
        }

        @Test
        @DisplayName("a new group should start at the beginning of the stream")
        void newGroupShouldStartAtBeginning() {
            broker.publish(STREAM, Map.of("n", 1));
            broker.publish(STREAM, Map.of("n", 2));

            assertEquals(2, broker.read(STREAM, "late", 10).size());
        }

        @Test
        @DisplayName("should isolate stored payload from caller mutation")
        void shouldIsolateStoredPayload() {
            Map<String, Object> payload = new HashMap<>();
            payload.put("n", 1);
            broker.publish(STREAM, payload);
            payload.put("n", 99);

            BrokerMessage delivered = next(STREAM, GROUP);
            assertEquals(1, delivered.payload().get("n"));
            delivered.payload().put("n", 42);

            assertEquals(1, next(STREAM, "other").payload().get("n"));
        }

        @Test
        @DisplayName("ensureGroup should register the group at position 0")
        void ensureGroupShouldRegisterGroup() {
            assertEquals(-1, broker.position(STREAM, GROUP));

            broker.ensureGroup(GROUP, STREAM);
            broker.ensureGroup(GROUP, STREAM);

            assertEquals(0, broker.position(STREAM, GROUP));
            assertTrue(broker.info().consumerGroups().containsKey(GROUP));
        }

        @Test
        @DisplayName("ensureGroup should reject blank names")
        void ensureGroupShouldRejectBlankNames() {
            assertThrows(IllegalArgumentException.class, () -> broker.ensureGroup("", STREAM));
        }

        @Test
        @DisplayName("should declare ordered messaging with blocking read and DLQ")
        void shouldDeclareCapabilities() {
            assertTrue(broker.hasCapability(BrokerCapability.MESSAGE_ORDERING));
            assertTrue(broker.hasCapability(BrokerCapability.BLOCKING_READ));
            assertTrue(broker.hasCapability(BrokerCapability.DEAD_LETTER_QUEUE));
            assertFalse(broker.hasCapability(BrokerCapability.REPLAY));
        }
    }

    @Nested
    @DisplayName("Acknowledgement")
    class AckTests {

        @Test
        @DisplayName("should acknowledge an in-flight message once")
        void shouldAcknowledgeOnce() {
            String id = broker.publish(STREAM, Map.of());
            next(STREAM, GROUP);

            assertTrue(broker.ack(STREAM, id, GROUP));
            assertFalse(broker.ack(STREAM, id, GROUP));
            assertEquals(0, broker.inFlightCount(STREAM, GROUP));
        }

        @Test
        @DisplayName("should track operation state")
        void shouldTrackOperationState() {
            String id = broker.publish(STREAM, Map.of());
            next(STREAM, GROUP);
            assertEquals(Optional.of(OperationState.PENDING), broker.operationState(GROUP, id));

            broker.ack(STREAM, id, GROUP);

            assertEquals(Optional.of(OperationState.ACKNOWLEDGED), broker.operationState(GROUP, id));
        }

        @Test
        @DisplayName("should reject ack of unknown message")
        void shouldRejectUnknownMessage() {
            broker.ensureGroup(GROUP, STREAM);

            assertFalse(broker.ack(STREAM, "missing", GROUP));
        }

        @Test
        @DisplayName("should reject ack from a group that does not own the message")
        void shouldRejectAckFromOtherGroup() {
            String id = broker.publish(STREAM, Map.of());
            next(STREAM, GROUP);
            broker.ensureGroup("other", STREAM);

            assertFalse(broker.ack(STREAM, id, "other"));
            assertTrue(broker.ack(STREAM, id, GROUP));
        }

        @Test
        @DisplayName("should reject ack on unregistered group or blank arguments")
        void shouldRejectAckOnUnregisteredGroup() {
            String id = broker.publish(STREAM, Map.of());

            assertFalse(broker.ack(STREAM, id, "nobody"));
            assertFalse(broker.ack("", id, GROUP));
            assertFalse(broker.ack(STREAM, null, GROUP));
        }

        @Test
        @DisplayName("should acknowledge a message waiting in the retry queue")
        void shouldAcknowledgeRetryQueuedMessage() {
            String id = broker.publish(STREAM, Map.of());
            next(STREAM, GROUP);
            broker.nack(STREAM, id, GROUP);

            assertTrue(broker.ack(STREAM, id, GROUP));
            assertTrue(broker.retryQueue(STREAM, GROUP).isEmpty());

            clock.advance(Duration.ofMinutes(1));
            assertTrue(broker.getNext(STREAM, GROUP).isEmpty());
        }

        @Test
        @DisplayName("should forget operation state after its TTL")
        void shouldForgetOperationStateAfterTtl() {
            String id = broker.publish(STREAM, Map.of());
            next(STREAM, GROUP);
            broker.ack(STREAM, id, GROUP);

            clock.advance(Duration.ofMinutes(6));
            broker.ack(STREAM, "unrelated", GROUP);

            assertTrue(broker.operationState(GROUP, id).isEmpty());
        }
    }

    @Nested
    @DisplayName("Negative acknowledgement and retries")
    class NackTests {

        @Test
        @DisplayName("should schedule redelivery after the retry delay")
        void shouldScheduleRedelivery() {
            String id = broker.publish(STREAM, Map.of("n", 1));
            next(STREAM, GROUP);

            assertTrue(broker.nack(STREAM, id, GROUP));

            List<RetryEntry> queue = broker.retryQueue(STREAM, GROUP);
            assertEquals(1, queue.size());
            assertEquals(1, queue.get(0).retryCount());
            assertEquals(clock.instant().plusSeconds(1), queue.get(0).nextRetryAt());
            assertEquals(1, broker.getRetryCount(STREAM, GROUP, id));
            assertEquals(Optional.of(OperationState.NACKED), broker.operationState(GROUP, id));

            assertTrue(broker.getNext(STREAM, GROUP).isEmpty());

            clock.advance(Duration.ofSeconds(1));
            BrokerMessage redelivered = next(STREAM, GROUP);
            assertEquals(id, redelivered.identifier());
            assertEquals(1, redelivered.payload().get("n"));
        }

        @Test
        @DisplayName("should double the delay for each retry")
        void shouldDoubleDelay() {
            String id = broker.publish(STREAM, Map.of());
            next(STREAM, GROUP);
            broker.nack(STREAM, id, GROUP);
            clock.advance(Duration.ofSeconds(1));
            next(STREAM, GROUP);

            broker.nack(STREAM, id, GROUP);

            RetryEntry entry = broker.retryQueue(STREAM, GROUP).get(0);
            assertEquals(2, entry.retryCount());
            assertEquals(clock.instant().plusSeconds(2), entry.nextRetryAt());
        }

        @Test
        @DisplayName("should reject a second nack before redelivery")
        void shouldRejectDuplicateNack() {
            String id = broker.publish(STREAM, Map.of());
            next(STREAM, GROUP);

            assertTrue(broker.nack(STREAM, id, GROUP));
            assertFalse(broker.nack(STREAM, id, GROUP));
            assertEquals(1, broker.getRetryCount(STREAM, GROUP, id));
        }

        @Test
        @DisplayName("should reject nack of a message that is not in flight")
        void shouldRejectNackOfNonLeasedMessage() {
            broker.ensureGroup(GROUP, STREAM);

            assertFalse(broker.nack(STREAM, "missing", GROUP));
            assertFalse(broker.nack(STREAM, "missing", ""));
        }

        @Test
        @DisplayName("should dead-letter after max retries are exhausted")
        void shouldDeadLetterAfterMaxRetries() {
            String id = broker.publish(STREAM, Map.of("n", 7));

            for (int attempt = 1; attempt <= 3; attempt++) {
                next(STREAM, GROUP);
                assertTrue(broker.nack(STREAM, id, GROUP));
                clock.advance(Duration.ofSeconds(10));
            }
            next(STREAM, GROUP);
            assertTrue(broker.nack(STREAM, id, GROUP));

            List<DeadLetterEntry> dlq = broker.getDlqMessages(GROUP, STREAM).get(STREAM);
            assertEquals(1, dlq.size());
            assertEquals(id, dlq.get(0).identifier());
            assertEquals(DeadLetterEntry.REASON_MAX_RETRIES, dlq.get(0).reason());
            assertEquals(7, dlq.get(0).payload().get("n"));
            assertEquals(0, broker.getRetryCount(STREAM, GROUP, id));
            assertTrue(broker.retryQueue(STREAM, GROUP).isEmpty());
            assertFalse(broker.ack(STREAM, id, GROUP));
        }

        @Test
        @DisplayName("should discard exhausted messages when DLQ is disabled")
        void shouldDiscardWhenDlqDisabled() {
            broker = new InlineBroker(new ObjectMapper(),
                BrokerSettings.defaults().withRetryPolicy(RetryPolicy.noRetry()).withEnableDlq(false), clock);
            String id = broker.publish(STREAM, Map.of());
            next(STREAM, GROUP);

            assertTrue(broker.nack(STREAM, id, GROUP));

            assertTrue(broker.getDlqMessages(GROUP, null).isEmpty());
            assertTrue(broker.retryQueue(STREAM, GROUP).isEmpty());
        }

        @Test
        @DisplayName("redelivery should not be seen by a group that already read past it")
        void redeliveryShouldNotLeakToOtherGroups() {
            String first = broker.publish(STREAM, Map.of("n", 1));
            String second = broker.publish(STREAM, Map.of("n", 2));

            next(STREAM, "a");
            broker.read(STREAM, "b", 10);
            broker.nack(STREAM, first, "a");
            clock.advance(Duration.ofSeconds(1));

            assertEquals(first, next(STREAM, "a").identifier());
            assertEquals(second, next(STREAM, "a").identifier());
            assertTrue(broker.getNext(STREAM, "b").isEmpty());
            assertEquals(3, broker.position(STREAM, "b"));
        }

        @Test
        @DisplayName("redelivery should not be seen by a group that has not reached it yet")
        void redeliveryShouldNotReachLaggingGroup() {
            String first = broker.publish(STREAM, Map.of("n", 1));
            String second = broker.publish(STREAM, Map.of("n", 2));
            String third = broker.publish(STREAM, Map.of("n", 3));

            assertEquals(first, next(STREAM, "b").identifier());
            assertTrue(broker.ack(STREAM, first, "b"));

            broker.read(STREAM, "a", 10);
            broker.nack(STREAM, first, "a");
            clock.advance(Duration.ofSeconds(2));
            assertEquals(first, next(STREAM, "a").identifier());

            List<BrokerMessage> rest = broker.read(STREAM, "b", 10);

            assertEquals(List.of(second, third), rest.stream().map(BrokerMessage::identifier).toList());
            assertTrue(broker.getNext(STREAM, "b").isEmpty());
            assertEquals(Optional.of(OperationState.ACKNOWLEDGED), broker.operationState("b", first));
        }

        @Test
        @DisplayName("redelivered messages should come before unread ones")
        void redeliveredMessagesShouldComeFirst() {
            String first = broker.publish(STREAM, Map.of("n", 1));
            String second = broker.publish(STREAM, Map.of("n", 2));
            String third = broker.publish(STREAM, Map.of("n", 3));
            next(STREAM, GROUP);
            next(STREAM, GROUP);
            broker.nack(STREAM, first, GROUP);
            broker.nack(STREAM, second, GROUP);
            clock.advance(Duration.ofSeconds(1));

            List<BrokerMessage> batch = broker.read(STREAM, GROUP, 10);

            assertEquals(List.of(first, second, third), batch.stream().map(BrokerMessage::identifier).toList());
        }
    }

    @Nested
    @DisplayName("Stale lease reclamation")
    class StaleTests {

        @Test
        @DisplayName("should move expired leases to the DLQ")
        void shouldMoveExpiredLeasesToDlq() {
            String id = broker.publish(STREAM, Map.of());
            next(STREAM, GROUP);
            clock.advance(Duration.ofSeconds(31));

            assertEquals(1, broker.cleanupStaleMessages(GROUP, Duration.ofSeconds(30)));

            DeadLetterEntry entry = broker.getDlqMessages(GROUP, STREAM).get(STREAM).get(0);
            assertEquals(id, entry.identifier());
            assertEquals(DeadLetterEntry.REASON_TIMEOUT, entry.reason());
            assertEquals(0, broker.inFlightCount(STREAM, GROUP));
            assertFalse(broker.ack(STREAM, id, GROUP));
        }

        @Test
        @DisplayName("should keep fresh leases")
        void shouldKeepFreshLeases() {
            broker.publish(STREAM, Map.of());
            next(STREAM, GROUP);
            clock.advance(Duration.ofSeconds(10));

            assertEquals(0, broker.cleanupStaleMessages(GROUP, Duration.ofSeconds(30)));
            assertEquals(1, broker.inFlightCount(STREAM, GROUP));
        }

        @Test
        @DisplayName("reads should reclaim leases older than the message timeout")
        void readsShouldReclaimStaleLeases() {
            broker.publish(STREAM, Map.of());
            next(STREAM, GROUP);
            clock.advance(Duration.ofMinutes(6));

            assertTrue(broker.getNext(STREAM, GROUP).isEmpty());

            assertEquals(0, broker.inFlightCount(STREAM, GROUP));
            assertEquals(1, broker.getDlqMessages(GROUP, STREAM).get(STREAM).size());
        }

        @Test
        @DisplayName("reclaimStaleLeases should sweep every group")
        void reclaimShouldSweepEveryGroup() {
            broker.publish(STREAM, Map.of());
            next(STREAM, "a");
            next(STREAM, "b");
            clock.advance(Duration.ofMinutes(6));

            assertEquals(2, broker.reclaimStaleLeases());
        }
    }

    @Nested
    @DisplayName("Dead-letter reprocessing")
    class ReprocessTests {

        private String deadLetter() {
            String id = broker.publish(STREAM, Map.of("n", 1));
            next(STREAM, GROUP);
            clock.advance(Duration.ofMinutes(6));
            broker.cleanupStaleMessages(GROUP, Duration.ofMinutes(5));
            return id;
        }

        @Test
        @DisplayName("should redeliver a reprocessed message next")
        void shouldRedeliverReprocessedMessage() {
            String id = deadLetter();
            String later = broker.publish(STREAM, Map.of("n", 2));

            assertTrue(broker.reprocessDlqMessage(id, GROUP, STREAM));

            assertTrue(broker.getDlqMessages(GROUP, STREAM).get(STREAM).isEmpty());
            assertEquals(id, next(STREAM, GROUP).identifier());
            assertEquals(later, next(STREAM, GROUP).identifier());
            assertTrue(broker.ack(STREAM, id, GROUP));
        }

        @Test
        @DisplayName("should shift cursors of other groups past the re-inserted copy")
        void shouldShiftOtherCursors() {
            String id = deadLetter();
            broker.read(STREAM, "other", 10);
            assertEquals(1, broker.position(STREAM, "other"));

            broker.reprocessDlqMessage(id, GROUP, STREAM);

            assertEquals(2, broker.position(STREAM, "other"));
            assertEquals(2, broker.streamLength(STREAM));
            assertTrue(broker.getNext(STREAM, "other").isEmpty());
        }

        @Test
        @DisplayName("should not deliver the re-inserted copy to a lagging group")
        void shouldNotDeliverCopyToLaggingGroup() {
            broker.ensureGroup("other", STREAM);
            String id = deadLetter();

            broker.reprocessDlqMessage(id, GROUP, STREAM);

            List<BrokerMessage> seen = broker.read(STREAM, "other", 10);
            assertEquals(List.of(id), seen.stream().map(BrokerMessage::identifier).toList());
            assertEquals(id, next(STREAM, GROUP).identifier());
        }

        @Test
        @DisplayName("should return false for unknown message")
        void shouldReturnFalseForUnknownMessage() {
            deadLetter();

            assertFalse(broker.reprocessDlqMessage("missing", GROUP, STREAM));
            assertFalse(broker.reprocessDlqMessage("missing", GROUP, "elsewhere"));
            assertFalse(broker.reprocessDlqMessage("", GROUP, STREAM));
        }

        @Test
        @DisplayName("should list DLQ entries of every stream when no stream is given")
        void shouldListAllStreams() {
            deadLetter();

            Map<String, List<DeadLetterEntry>> all = broker.getDlqMessages(GROUP, null);

            assertEquals(1, all.size());
            assertEquals(1, all.get(STREAM).size());
        }
    }

    @Nested
    @DisplayName("Blocking read")
    class BlockingReadTests {

        @Test
        @DisplayName("should return available messages immediately")
        void shouldReturnAvailableMessages() {
            broker.publish(STREAM, Map.of("n", 1));
            broker.publish(STREAM, Map.of("n", 2));
            broker.publish(STREAM, Map.of("n", 3));

            List<BrokerMessage> batch = broker.readBlocking(STREAM, GROUP, "c1", Duration.ofSeconds(5), 2);

            assertEquals(2, batch.size());
        }

        @Test
        @DisplayName("should return empty after timeout")
        void shouldReturnEmptyAfterTimeout() {
            long start = System.nanoTime();

            List<BrokerMessage> batch = broker.readBlocking(STREAM, GROUP, "c1", Duration.ofMillis(50), 10);

            assertTrue(batch.isEmpty());
            assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(50));
        }

        @Test
        @DisplayName("should wake up when a message is published")
        void shouldWakeUpOnPublish() throws Exception {
            CompletableFuture<List<BrokerMessage>> reader = CompletableFuture.supplyAsync(
                () -> broker.readBlocking(STREAM, GROUP, "c1", Duration.ofSeconds(10), 10));

            Thread.sleep(100);
            String id = broker.publish(STREAM, Map.of());

            List<BrokerMessage> batch = reader.get(5, TimeUnit.SECONDS);
            assertEquals(1, batch.size());
            assertEquals(id, batch.get(0).identifier());
        }

        @Test
        @DisplayName("should time out normally when the next retry is centuries away")
        void shouldTimeOutWithDistantRetry() {
            broker = new InlineBroker(new ObjectMapper(),
                BrokerSettings.defaults().withRetryPolicy(new RetryPolicy(3, Duration.ofDays(365L * 300), 2.0)),
                clock);
            String id = broker.publish(STREAM, Map.of());
            next(STREAM, GROUP);
            assertTrue(broker.nack(STREAM, id, GROUP));

            List<BrokerMessage> batch = assertDoesNotThrow(
                () -> broker.readBlocking(STREAM, GROUP, "c1", Duration.ofMillis(50), 10));

            assertTrue(batch.isEmpty());
            assertEquals(1, broker.retryQueue(STREAM, GROUP).size());
        }

        @Test
        @DisplayName("should record the consumer name")
        void shouldRecordConsumerName() {
            broker.readBlocking(STREAM, GROUP, "worker-1", Duration.ZERO, 1);

            assertEquals(Set.of("worker-1"), broker.info().consumerGroups().get(GROUP).consumers());
        }
    }

    @Nested
    @DisplayName("Introspection")
    class IntrospectionTests {

        @Test
        @DisplayName("info should report per-stream counts")
        void infoShouldReportCounts() {
            String first = broker.publish(STREAM, Map.of());
            broker.publish(STREAM, Map.of());
            next(STREAM, GROUP);
            next(STREAM, GROUP);
            broker.nack(STREAM, first, GROUP);

            BrokerInfo info = broker.info();

            ConsumerGroupInfo group = info.consumerGroups().get(GROUP);
            assertEquals(GROUP, group.name());
            assertEquals(clock.instant(), group.createdAt());
            assertEquals(1, group.inFlightMessages().get(STREAM));
            assertEquals(1, group.failedMessages().get(STREAM));
            assertEquals(0, group.dlqMessages().get(STREAM));
        }

        @Test
        @DisplayName("health should report message counts and configuration")
        @SuppressWarnings("unchecked")
        void healthShouldReportDetails() {
            broker.publish(STREAM, Map.of("n", 1));
            broker.publish("payments", Map.of("n", 2));
            next(STREAM, GROUP);

            BrokerHealthStats stats = broker.healthStats();

            assertEquals(BrokerHealthStatus.HEALTHY, stats.status());
            assertTrue(stats.connected());

            Map<String, Object> counts = (Map<String, Object>) stats.details().get("message_counts");
            assertEquals(2, counts.get("total_messages"));
            assertEquals(1, counts.get("in_flight"));
            assertEquals(0, counts.get("failed"));
            assertEquals(0, counts.get("dlq"));

            Map<String, Object> streams = (Map<String, Object>) stats.details().get("streams");
            assertEquals(List.of(STREAM, "payments"), streams.get("names"));

            Map<String, Object> groups = (Map<String, Object>) stats.details().get("consumer_groups");
            assertEquals(1, groups.get("count"));

            Map<String, Object> configuration = (Map<String, Object>) stats.details().get("configuration");
            assertEquals(3, configuration.get("max_retries"));
            assertEquals(1.0, configuration.get("retry_delay"));
            assertEquals(300.0, configuration.get("message_timeout"));
            assertEquals(true, configuration.get("enable_dlq"));

            assertTrue((Long) stats.details().get("memory_estimate_bytes") > 0);
        }

        @Test
        @DisplayName("dataReset should drop all state")
        void dataResetShouldDropAllState() {
            broker.publish(STREAM, Map.of());
            next(STREAM, GROUP);

            broker.dataReset();

            assertEquals(0, broker.streamLength(STREAM));
            assertEquals(-1, broker.position(STREAM, GROUP));
            assertTrue(broker.info().consumerGroups().isEmpty());
        }
    }
}
