package com.ivamare.eventbroker.subscription.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventbroker.MutableClock;
import com.ivamare.eventbroker.broker.Broker;
import com.ivamare.eventbroker.broker.BrokerSettings;
import com.ivamare.eventbroker.broker.impl.InlineBroker;
import com.ivamare.eventbroker.exception.SubscriptionException;
import com.ivamare.eventbroker.handler.MessageHandler;
import com.ivamare.eventbroker.message.MessageCodec;
import com.ivamare.eventbroker.message.MessageTypeRegistry;
import com.ivamare.eventbroker.model.BrokerMessage;
import com.ivamare.eventbroker.model.DomainMeta;
import com.ivamare.eventbroker.model.Message;
import com.ivamare.eventbroker.model.MessageHeaders;
import com.ivamare.eventbroker.model.MessageKind;
import com.ivamare.eventbroker.subscription.PriorityLanesConfig;
import com.ivamare.eventbroker.subscription.Subscription;
import com.ivamare.eventbroker.subscription.SubscriptionBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("StreamSubscription")
class StreamSubscriptionTest {

    record OrderPlaced(String orderId) {}

    private static final String STREAM = "orders";
    private static final String GROUP = "projector";
    private static final String TYPE = "Shop.OrderPlaced.v1";

    private MutableClock clock;
    private MessageCodec codec;
    private RecordingHandler handler;

    static class RecordingHandler implements MessageHandler {
        final List<Object> handled = new CopyOnWriteArrayList<>();
        volatile int failuresLeft;
        volatile CountDownLatch latch = new CountDownLatch(0);

        @Override
        public void handle(Message message, Object domainObject) {
            if (failuresLeft > 0) {
                failuresLeft--;
                throw new IllegalStateException("handler failed");
            }
            handled.add(domainObject);
            latch.countDown();
        }
    }

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        MessageTypeRegistry registry = new MessageTypeRegistry();
        registry.register(TYPE, OrderPlaced.class);
        codec = new MessageCodec(new ObjectMapper(), registry);
        handler = new RecordingHandler();
    }

    private Map<String, Object> payload(String orderId) {
        Message message = codec.build(
            new MessageHeaders(UUID.randomUUID().toString(), clock.instant(), TYPE, STREAM + "-" + orderId, null, null),
            DomainMeta.of("shop.OrderPlaced", MessageKind.EVENT, STREAM, null),
            Map.of("orderId", orderId));
        return codec.serialize(message);
    }

    private SubscriptionBuilder builder(Broker broker) {
        return Subscription.builder()
            .broker(broker)
            .codec(codec)
            .handler(handler)
            .stream(STREAM)
            .consumerGroup(GROUP)
            .blockingTimeout(Duration.ZERO)
            .clock(clock);
    }

    @Nested
    @DisplayName("Batch processing")
    class BatchTests {

        private Broker broker;

        @BeforeEach
        void setUp() {
            broker = mock(Broker.class);
            when(broker.ack(anyString(), anyString(), anyString())).thenReturn(true);
        }

        @Test
        @DisplayName("should handle and acknowledge valid messages")
        void shouldHandleAndAcknowledge() {
            StreamSubscription subscription = builder(broker).build();

            int handled = subscription.processBatch(List.of(new BrokerMessage("m1", payload("42"))));

            assertEquals(1, handled);
            assertEquals(List.of(new OrderPlaced("42")), handler.handled);
            verify(broker).ack(STREAM, "m1", GROUP);
            assertEquals(1, subscription.processedCount());
        }

        @Test
        @DisplayName("should dead-letter and acknowledge malformed messages")
        @SuppressWarnings("unchecked")
        void shouldDeadLetterMalformedMessages() {
            StreamSubscription subscription = builder(broker).build();

            int handled = subscription.processBatch(List.of(new BrokerMessage("bad", Map.of("data", Map.of()))));

            assertEquals(0, handled);
            assertTrue(handler.handled.isEmpty());

            ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
            verify(broker).publish(eq("orders:dlq"), captor.capture());
            verify(broker).ack(STREAM, "bad", GROUP);

            Map<String, Object> dlq = captor.getValue();
            assertEquals(Map.of(), dlq.get("data"));
            Map<String, Object> meta = (Map<String, Object>) dlq.get(StreamSubscription.DLQ_METADATA_KEY);
            assertEquals(STREAM, meta.get("original_stream"));
            assertEquals("bad", meta.get("original_id"));
            assertEquals(GROUP, meta.get("consumer_group"));
            assertEquals(subscription.consumerName(), meta.get("consumer"));
            assertEquals("2024-01-01T00:00:00Z", meta.get("failed_at"));
            assertEquals(0, meta.get("retry_count"));
        }

        @Test
        @DisplayName("should keep processing the batch after a bad message")
        void shouldContinueAfterBadMessage() {
            StreamSubscription subscription = builder(broker).build();

            int handled = subscription.processBatch(List.of(
                new BrokerMessage("bad", Map.of()),
                new BrokerMessage("m2", payload("43"))));

            assertEquals(1, handled);
            assertEquals(List.of(new OrderPlaced("43")), handler.handled);
        }

        @Test
        @DisplayName("should nack handler failures below max retries")
        void shouldNackBelowMaxRetries() {
            handler.failuresLeft = 1;
            StreamSubscription subscription = builder(broker).maxRetries(3).build();

            subscription.processBatch(List.of(new BrokerMessage("m1", payload("42"))));

            verify(broker).nack(STREAM, "m1", GROUP);
            verify(broker, never()).ack(anyString(), anyString(), anyString());
            verify(broker, never()).publish(anyString(), anyMap());
            assertEquals(1, subscription.retryCount("m1"));
        }

        @Test
        @DisplayName("should dead-letter after max retries")
        @SuppressWarnings("unchecked")
        void shouldDeadLetterAfterMaxRetries() {
            handler.failuresLeft = 2;
            StreamSubscription subscription = builder(broker).maxRetries(2).build();
            BrokerMessage message = new BrokerMessage("m1", payload("42"));

            subscription.processBatch(List.of(message));
            subscription.processBatch(List.of(message));

            verify(broker, times(1)).nack(STREAM, "m1", GROUP);
            ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
            verify(broker).publish(eq("orders:dlq"), captor.capture());
            verify(broker).ack(STREAM, "m1", GROUP);

            Map<String, Object> meta = (Map<String, Object>) captor.getValue().get(StreamSubscription.DLQ_METADATA_KEY);
            assertEquals(2, meta.get("retry_count"));
            assertEquals(0, subscription.retryCount("m1"));
        }

        @Test
        @DisplayName("should not publish to DLQ when disabled")
        void shouldNotPublishWhenDlqDisabled() {
            StreamSubscription subscription = builder(broker).enableDlq(false).build();

            subscription.processBatch(List.of(new BrokerMessage("bad", Map.of())));

            verify(broker, never()).publish(anyString(), anyMap());
            verify(broker).ack(STREAM, "bad", GROUP);
        }

        @Test
        @DisplayName("should acknowledge even when DLQ publish fails")
        void shouldAcknowledgeWhenDlqPublishFails() {
            when(broker.publish(anyString(), anyMap())).thenThrow(new IllegalStateException("broker down"));
            StreamSubscription subscription = builder(broker).build();

            assertDoesNotThrow(() -> subscription.processBatch(List.of(new BrokerMessage("bad", Map.of()))));

            verify(broker).ack(STREAM, "bad", GROUP);
        }

        @Test
        @DisplayName("should not count a message whose ack fails")
        void shouldNotCountFailedAck() {
            when(broker.ack(anyString(), anyString(), anyString())).thenReturn(false);
            StreamSubscription subscription = builder(broker).build();

            assertEquals(0, subscription.processBatch(List.of(new BrokerMessage("m1", payload("42")))));
            assertEquals(0, subscription.processedCount());
        }
    }

    @Nested
    @DisplayName("Reading")
    class ReadTests {

        private Broker broker;

        @BeforeEach
        void setUp() {
            broker = mock(Broker.class);
        }

        @Test
        @DisplayName("should read the primary stream with the blocking timeout")
        void shouldReadPrimaryStream() {
            StreamSubscription subscription = builder(broker).blockingTimeout(Duration.ofSeconds(5))
                .messagesPerTick(7).build();

            subscription.nextBatch();

            verify(broker).readBlocking(STREAM, GROUP, subscription.consumerName(), Duration.ofSeconds(5), 7);
        }

        @Test
        @DisplayName("should count read errors and return an empty batch")
        void shouldCountReadErrors() {
            when(broker.readBlocking(anyString(), anyString(), anyString(), any(), anyInt()))
                .thenThrow(new IllegalStateException("read failed"));
            StreamSubscription subscription = builder(broker).build();

            assertTrue(subscription.nextBatch().isEmpty());
            assertTrue(subscription.nextBatch().isEmpty());

            assertEquals(2, subscription.consecutiveReadErrors());
        }

        @Test
        @DisplayName("initialize should create the consumer group")
        void initializeShouldCreateGroup() {
            builder(broker).build().initialize();

            verify(broker).ensureGroup(GROUP, STREAM);
        }

        @Test
        @DisplayName("initialize should wrap broker failures")
        void initializeShouldWrapFailures() {
            doThrow(new IllegalStateException("boom")).when(broker).ensureGroup(anyString(), anyString());
            StreamSubscription subscription = builder(broker).build();

            SubscriptionException ex = assertThrows(SubscriptionException.class, subscription::initialize);

            assertInstanceOf(IllegalStateException.class, ex.getCause());
            assertFalse(subscription.isRunning());
        }
    }

    @Nested
    @DisplayName("Priority lanes")
    class PriorityLaneTests {

        private Broker broker;
        private StreamSubscription subscription;

        @BeforeEach
        void setUp() {
            broker = mock(Broker.class);
            when(broker.ack(anyString(), anyString(), anyString())).thenReturn(true);
            subscription = builder(broker)
                .priorityLanes(new PriorityLanesConfig(true, 0, "backfill"))
                .blockingTimeout(Duration.ofSeconds(5))
                .backfillMaxWait(Duration.ofMillis(200))
                .build();
        }

        @Test
        @DisplayName("initialize should create the group on both lanes")
        void initializeShouldCreateGroupOnBothLanes() {
            subscription.initialize();

            verify(broker).ensureGroup(GROUP, STREAM);
            verify(broker).ensureGroup(GROUP, "orders:backfill");
        }

        @Test
        @DisplayName("should not touch backfill while primary has messages")
        void shouldPreferPrimary() {
            when(broker.readBlocking(eq(STREAM), anyString(), anyString(), any(), anyInt()))
                .thenReturn(List.of(new BrokerMessage("p1", payload("1"))));

            List<BrokerMessage> batch = subscription.nextBatch();

            assertEquals(1, batch.size());
            assertEquals(STREAM, subscription.activeStream());
            verify(broker).readBlocking(eq(STREAM), anyString(), anyString(), eq(Duration.ZERO), anyInt());
            verify(broker, never()).readBlocking(eq("orders:backfill"), anyString(), anyString(), any(), anyInt());
        }

        @Test
        @DisplayName("should wait on backfill for at most the backfill cap")
        void shouldWaitOnBackfill() {
            when(broker.readBlocking(eq(STREAM), anyString(), anyString(), any(), anyInt())).thenReturn(List.of());
            when(broker.readBlocking(eq("orders:backfill"), anyString(), anyString(), any(), anyInt()))
                .thenReturn(List.of(new BrokerMessage("b1", payload("2"))));

            List<BrokerMessage> batch = subscription.nextBatch();

            assertEquals(1, batch.size());
            assertEquals("orders:backfill", subscription.activeStream());
            verify(broker).readBlocking(eq("orders:backfill"), anyString(), anyString(),
                eq(Duration.ofMillis(200)), anyInt());
        }

        @Test
        @DisplayName("should acknowledge and dead-letter on the lane the batch came from")
        void shouldUseBackfillLaneForAckAndDlq() {
            when(broker.readBlocking(eq(STREAM), anyString(), anyString(), any(), anyInt())).thenReturn(List.of());
            when(broker.readBlocking(eq("orders:backfill"), anyString(), anyString(), any(), anyInt()))
                .thenReturn(List.of(new BrokerMessage("b1", payload("2")), new BrokerMessage("bad", Map.of())));

            subscription.processBatch(subscription.nextBatch());

            verify(broker).ack("orders:backfill", "b1", GROUP);
            verify(broker).ack("orders:backfill", "bad", GROUP);
            verify(broker).publish(eq("orders:backfill:dlq"), anyMap());
            assertEquals(STREAM, subscription.activeStream());
        }

        @Test
        @DisplayName("should reset the active lane when both lanes are empty")
        void shouldResetActiveLaneWhenEmpty() {
            when(broker.readBlocking(anyString(), anyString(), anyString(), any(), anyInt())).thenReturn(List.of());

            assertTrue(subscription.nextBatch().isEmpty());

            assertEquals(STREAM, subscription.activeStream());
        }
    }

    @Nested
    @DisplayName("With InlineBroker")
    class InlineBrokerTests {

        private InlineBroker broker;

        @BeforeEach
        void setUp() {
            broker = new InlineBroker(new ObjectMapper(), BrokerSettings.defaults(), clock);
        }

        @Test
        @DisplayName("should process published messages in order")
        void shouldProcessInOrder() {
            broker.publish(STREAM, payload("1"));
            broker.publish(STREAM, payload("2"));
            broker.publish(STREAM, payload("3"));
            StreamSubscription subscription = builder(broker).messagesPerTick(2).build();

            subscription.poll(2);

            assertEquals(List.of(new OrderPlaced("1"), new OrderPlaced("2"), new OrderPlaced("3")), handler.handled);
            assertEquals(0, broker.inFlightCount(STREAM, GROUP));
        }

        @Test
        @DisplayName("should retry through the broker and dead-letter on exhaustion")
        void shouldRetryThenDeadLetter() {
            handler.failuresLeft = 3;
            String id = broker.publish(STREAM, payload("1"));
            StreamSubscription subscription = builder(broker).maxRetries(3).build();

            subscription.poll(1);
            assertEquals(1, broker.getRetryCount(STREAM, GROUP, id));
            clock.advance(Duration.ofSeconds(1));
            subscription.poll(1);
            clock.advance(Duration.ofSeconds(2));
            subscription.poll(1);

            assertTrue(handler.handled.isEmpty());
            assertEquals(1, broker.streamLength("orders:dlq"));
            assertEquals(0, broker.inFlightCount(STREAM, GROUP));
            assertTrue(broker.retryQueue(STREAM, GROUP).isEmpty());

            BrokerMessage dlq = broker.getNext("orders:dlq", "ops").orElseThrow();
            assertTrue(dlq.payload().containsKey(StreamSubscription.DLQ_METADATA_KEY));
        }

        @Test
        @DisplayName("should recover when the handler succeeds on redelivery")
        void shouldRecoverOnRedelivery() {
            handler.failuresLeft = 1;
            broker.publish(STREAM, payload("1"));
            StreamSubscription subscription = builder(broker).build();

            subscription.poll(1);
            clock.advance(Duration.ofSeconds(1));
            subscription.poll(1);

            assertEquals(List.of(new OrderPlaced("1")), handler.handled);
            assertEquals(0, broker.streamLength("orders:dlq"));
        }

        @Test
        @DisplayName("should drain primary lane before backfill")
        void shouldDrainPrimaryBeforeBackfill() {
            broker.publish("orders:backfill", payload("low"));
            broker.publish(STREAM, payload("high"));
            StreamSubscription subscription = builder(broker)
                .priorityLanes(new PriorityLanesConfig(true, 0, "backfill"))
                .backfillMaxWait(Duration.ZERO)
                .build();

            subscription.poll(2);

            assertEquals(List.of(new OrderPlaced("high"), new OrderPlaced("low")), handler.handled);
            assertEquals(0, broker.inFlightCount("orders:backfill", GROUP));
        }

        @Test
        @DisplayName("should start and stop a polling thread")
        void shouldStartAndStop() throws Exception {
            handler.latch = new CountDownLatch(1);
            StreamSubscription subscription = builder(broker).blockingTimeout(Duration.ofMillis(50)).build();

            subscription.start();
            assertTrue(subscription.isRunning());
            broker.publish(STREAM, payload("1"));

            assertTrue(handler.latch.await(5, TimeUnit.SECONDS));
            subscription.stop(Duration.ofSeconds(1)).get(5, TimeUnit.SECONDS);

            assertFalse(subscription.isRunning());
            assertEquals(List.of(new OrderPlaced("1")), handler.handled);
        }

        @Test
        @DisplayName("stopNow should stop immediately")
        void stopNowShouldStopImmediately() {
            StreamSubscription subscription = builder(broker).blockingTimeout(Duration.ofMillis(50)).build();
            subscription.start();

            subscription.stopNow();

            assertFalse(subscription.isRunning());
        }
    }
}
