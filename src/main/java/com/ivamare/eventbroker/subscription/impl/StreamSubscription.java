package com.ivamare.eventbroker.subscription.impl;

import com.ivamare.eventbroker.broker.Broker;
import com.ivamare.eventbroker.exception.DeserializationException;
import com.ivamare.eventbroker.exception.SubscriptionException;
import com.ivamare.eventbroker.handler.MessageHandler;
import com.ivamare.eventbroker.message.MessageCodec;
import com.ivamare.eventbroker.model.BrokerMessage;
import com.ivamare.eventbroker.model.Message;
import com.ivamare.eventbroker.subscription.PriorityLanesConfig;
import com.ivamare.eventbroker.subscription.StreamNames;
import com.ivamare.eventbroker.subscription.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Subscription reading a broker stream in batches.
 *
 * <p>For every message of a batch:
 * <ol>
 *   <li>The raw payload is deserialized and validated. Failures are published to
 *       the dead-letter stream, acknowledged and skipped.</li>
 *   <li>The handler is invoked. Success acknowledges the message.</li>
 *   <li>On handler failure the local retry count grows; below {@code maxRetries}
 *       the message is nacked for broker redelivery, otherwise it is published to
 *       the dead-letter stream and acknowledged.</li>
 * </ol>
 *
 * <p>With priority lanes enabled the primary stream is read without waiting
 * first; only when it is empty does the subscription wait on the backfill lane.
 */
public class StreamSubscription implements Subscription {

    private static final Logger log = LoggerFactory.getLogger(StreamSubscription.class);

    static final String DLQ_METADATA_KEY = "_dlq_metadata";

    private final Broker broker;
    private final MessageCodec codec;
    private final MessageHandler handler;
    private final String streamCategory;
    private final String consumerGroup;
    private final String consumerName;
    private final int messagesPerTick;
    private final Duration blockingTimeout;
    private final int maxRetries;
    private final boolean enableDlq;
    private final PriorityLanesConfig priorityLanes;
    private final Duration backfillMaxWait;
    private final Clock clock;

    private final Map<String, Integer> retryCounts = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final AtomicInteger inFlightCount = new AtomicInteger(0);
    private final AtomicLong processedCount = new AtomicLong(0);
    private final AtomicInteger consecutiveReadErrors = new AtomicInteger(0);

    private volatile String activeStream;
    private ExecutorService executor;

    /**
     * Creates a new StreamSubscription.
     *
     * @param broker Broker to read from
     * @param codec Codec validating raw payloads
     * @param handler Handler messages are dispatched to
     * @param streamCategory Stream to consume
     * @param consumerGroup Consumer group, or null for the handler's class name
     * @param messagesPerTick Maximum batch size
     * @param blockingTimeout How long a read waits for messages
     * @param maxRetries Handler attempts before dead-lettering
     * @param enableDlq Whether failed messages go to the dead-letter stream
     * @param priorityLanes Priority lane settings
     * @param backfillMaxWait Cap on the wait of a backfill read
     * @param clock Clock for failure timestamps
     */
    public StreamSubscription(
            Broker broker,
            MessageCodec codec,
            MessageHandler handler,
            String streamCategory,
            String consumerGroup,
            int messagesPerTick,
            Duration blockingTimeout,
            int maxRetries,
            boolean enableDlq,
            PriorityLanesConfig priorityLanes,
            Duration backfillMaxWait,
            Clock clock) {
        this.broker = broker;
        this.codec = codec;
        this.handler = handler;
        this.streamCategory = streamCategory;
        this.consumerGroup = consumerGroup != null && !consumerGroup.isBlank()
            ? consumerGroup
            : handler.getClass().getName();
        this.consumerName = generateConsumerName(handler.getClass().getSimpleName());
        this.messagesPerTick = messagesPerTick;
        this.blockingTimeout = blockingTimeout;
        this.maxRetries = maxRetries;
        this.enableDlq = enableDlq;
        this.priorityLanes = priorityLanes;
        this.backfillMaxWait = backfillMaxWait;
        this.clock = clock;
        this.activeStream = streamCategory;
    }

    // --- Lifecycle ---

    /**
     * Ensure the consumer group exists on the primary stream, and on the backfill
     * lane when priority lanes are enabled.
     *
     * @throws SubscriptionException if the group cannot be created
     */
    public void initialize() {
        if (broker == null) {
            throw new SubscriptionException("No broker configured for subscription " + consumerGroup);
        }
        try {
            broker.ensureGroup(consumerGroup, streamCategory);
            if (priorityLanes.enabled()) {
                broker.ensureGroup(consumerGroup, backfillStream());
            }
        } catch (RuntimeException e) {
            log.error("Failed to ensure consumer group {}: {}", consumerGroup, e.getMessage());
            throw new SubscriptionException("Failed to ensure consumer group " + consumerGroup, e);
        }

        log.info("Initialized subscription {} on stream {} (lanes={})",
            consumerGroup, streamCategory, priorityLanes.enabled());
    }

    @Override
    public void start() {
        if (running.getAndSet(true)) {
            log.warn("Subscription {} already running", consumerGroup);
            return;
        }

        stopping.set(false);
        try {
            initialize();
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }

        String threadName = "subscription-" + handler.getClass().getSimpleName();
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, threadName);
            thread.setDaemon(true);
            return thread;
        });

        log.info("Starting subscription {} as consumer {}", consumerGroup, consumerName);
        executor.submit(this::runLoop);
    }

    @Override
    public CompletableFuture<Void> stop(Duration timeout) {
        if (!running.get()) {
            return CompletableFuture.completedFuture(null);
        }

        stopping.set(true);
        log.info("Stopping subscription {}, waiting for {} in-flight messages",
            consumerGroup, inFlightCount.get());

        return CompletableFuture.runAsync(() -> {
            try {
                long deadline = System.currentTimeMillis() + timeout.toMillis();
                while (inFlightCount.get() > 0 && System.currentTimeMillis() < deadline) {
                    Thread.sleep(100);
                }

                if (inFlightCount.get() > 0) {
                    log.warn("Timeout waiting for {} in-flight messages", inFlightCount.get());
                }

                executor.shutdown();
                // A blocking read may still be waiting
                if (!executor.awaitTermination(blockingTimeout.toMillis() + 1000, TimeUnit.MILLISECONDS)) {
                    executor.shutdownNow();
                }

                running.set(false);
                cleanup();
                log.info("Subscription {} stopped", consumerGroup);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
    }

    @Override
    public void stopNow() {
        stopping.set(true);
        running.set(false);
        if (executor != null) {
            executor.shutdownNow();
        }
        cleanup();
    }

    @Override
    public boolean isRunning() {
        return running.get() && !stopping.get();
    }

    @Override
    public int inFlightCount() {
        return inFlightCount.get();
    }

    /**
     * Clear pipeline retry bookkeeping.
     */
    public void cleanup() {
        retryCounts.clear();
    }

    // --- Main Processing Loop ---

    private void runLoop() {
        log.debug("Subscription loop started for {}", consumerGroup);
        try {
            poll(UNBOUNDED);
        } catch (Exception e) {
            if (!stopping.get()) {
                log.error("Subscription loop crashed for {}", consumerGroup, e);
            }
        } finally {
            running.set(false);
            log.debug("Subscription loop ended for {}", consumerGroup);
        }
    }

    /**
     * Read and process batches until stopped or the iteration budget is used up.
     *
     * @param maxIterations number of read cycles, or {@link #UNBOUNDED}
     */
    public void poll(long maxIterations) {
        for (long iteration = 0; maxIterations == UNBOUNDED || iteration < maxIterations; iteration++) {
            if (stopping.get() || Thread.currentThread().isInterrupted()) {
                return;
            }

            List<BrokerMessage> batch = nextBatch();
            if (!batch.isEmpty()) {
                processBatch(batch);
            }

            Thread.yield();
        }
    }

    /**
     * Read the next batch, preferring the primary lane when priority lanes are enabled.
     *
     * <p>Read errors are logged and yield an empty batch.
     *
     * @return the batch, possibly empty
     */
    public List<BrokerMessage> nextBatch() {
        activeStream = streamCategory;

        if (!priorityLanes.enabled()) {
            return read(streamCategory, blockingTimeout);
        }

        List<BrokerMessage> primary = read(streamCategory, Duration.ZERO);
        if (!primary.isEmpty()) {
            return primary;
        }

        String backfill = backfillStream();
        activeStream = backfill;
        Duration wait = blockingTimeout.compareTo(backfillMaxWait) < 0 ? blockingTimeout : backfillMaxWait;
        List<BrokerMessage> backfillBatch = read(backfill, wait);
        if (backfillBatch.isEmpty()) {
            activeStream = streamCategory;
        }
        return backfillBatch;
    }

    private List<BrokerMessage> read(String stream, Duration timeout) {
        try {
            List<BrokerMessage> messages = broker.readBlocking(
                stream, consumerGroup, consumerName, timeout, messagesPerTick);
            consecutiveReadErrors.set(0);
            return messages;
        } catch (RuntimeException e) {
            consecutiveReadErrors.incrementAndGet();
            log.error("Error reading messages from stream {}: {}", stream, e.getMessage());
            return List.of();
        }
    }

    /**
     * Process a batch read from the active stream.
     *
     * @param messages the batch
     * @return number of messages handled and acknowledged
     */
    public int processBatch(List<BrokerMessage> messages) {
        String stream = activeStream;
        log.debug("Processing {} messages from {}", messages.size(), stream);

        int successful = 0;
        try {
            for (BrokerMessage raw : messages) {
                inFlightCount.incrementAndGet();
                try {
                    if (processMessage(stream, raw)) {
                        successful++;
                    }
                } finally {
                    inFlightCount.decrementAndGet();
                }
            }
        } finally {
            activeStream = streamCategory;
        }
        return successful;
    }

    private boolean processMessage(String stream, BrokerMessage raw) {
        String identifier = raw.identifier();

        Message message;
        Object domainObject;
        try {
            message = codec.deserialize(identifier, raw.payload());
            domainObject = codec.toDomainObject(identifier, message);
        } catch (DeserializationException e) {
            log.error("Failed to deserialize message {}: {}. Moving to DLQ.", identifier, e.getMessage());
            moveToDlq(stream, identifier, raw.payload());
            broker.ack(stream, identifier, consumerGroup);
            return false;
        }

        log.info("{}-{} : handling in {}", message.type(), message.id(), consumerGroup);

        try {
            handler.handle(message, domainObject);
        } catch (Exception e) {
            log.error("Error handling message {} in {}: {}", identifier, consumerGroup, e.getMessage(), e);
            handleFailedMessage(stream, identifier, raw.payload());
            return false;
        }

        if (broker.ack(stream, identifier, consumerGroup)) {
            retryCounts.remove(identifier);
            processedCount.incrementAndGet();
            return true;
        }
        log.warn("Failed to acknowledge message {}", identifier);
        return false;
    }

    private void handleFailedMessage(String stream, String identifier, Map<String, Object> payload) {
        int retryCount = retryCounts.merge(identifier, 1, Integer::sum);

        if (retryCount < maxRetries) {
            log.warn("Message {} failed (attempt {}/{}), returning to broker for redelivery",
                identifier, retryCount, maxRetries);
            broker.nack(stream, identifier, consumerGroup);
            return;
        }

        log.error("Message {} failed after {} attempts, moving to DLQ", identifier, maxRetries);
        moveToDlq(stream, identifier, payload);
        broker.ack(stream, identifier, consumerGroup);
        retryCounts.remove(identifier);
    }

    /**
     * Publish a message to the dead-letter stream of {@code stream}, wrapped with failure metadata.
     * Publishing failures are logged, never thrown.
     */
    void moveToDlq(String stream, String identifier, Map<String, Object> payload) {
        if (!enableDlq) {
            return;
        }

        String dlqStream = StreamNames.dlq(stream);
        try {
            broker.publish(dlqStream, createDlqMessage(stream, identifier, payload));
            log.info("Moved message {} to DLQ stream {}", identifier, dlqStream);
        } catch (RuntimeException e) {
            log.error("Failed to move message {} to DLQ: {}", identifier, e.getMessage());
        }
    }

    private Map<String, Object> createDlqMessage(String stream, String identifier, Map<String, Object> payload) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("original_stream", stream);
        metadata.put("original_id", identifier);
        metadata.put("consumer_group", consumerGroup);
        metadata.put("consumer", consumerName);
        metadata.put("failed_at", clock.instant().toString());
        metadata.put("retry_count", retryCounts.getOrDefault(identifier, 0));

        Map<String, Object> message = payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>();
        message.put(DLQ_METADATA_KEY, metadata);
        return message;
    }

    // --- Accessors ---

    @Override
    public String stream() {
        return streamCategory;
    }

    @Override
    public String consumerGroup() {
        return consumerGroup;
    }

    @Override
    public String consumerName() {
        return consumerName;
    }

    public String dlqStream() {
        return StreamNames.dlq(streamCategory);
    }

    public String backfillStream() {
        return StreamNames.backfill(streamCategory, priorityLanes.backfillSuffix());
    }

    public String backfillDlqStream() {
        return StreamNames.backfillDlq(streamCategory, priorityLanes.backfillSuffix());
    }

    public PriorityLanesConfig priorityLanes() {
        return priorityLanes;
    }

    /**
     * Stream the current batch was read from; the primary stream between batches.
     */
    public String activeStream() {
        return activeStream;
    }

    /**
     * Pipeline retry count of a message, 0 if it never failed.
     */
    public int retryCount(String identifier) {
        return retryCounts.getOrDefault(identifier, 0);
    }

    @Override
    public long processedCount() {
        return processedCount.get();
    }

    @Override
    public int consecutiveReadErrors() {
        return consecutiveReadErrors.get();
    }

    private static String generateConsumerName(String handlerName) {
        String hostname;
        try {
            hostname = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            hostname = "localhost";
        }
        long pid = ProcessHandle.current().pid();

        byte[] random = new byte[3];
        new SecureRandom().nextBytes(random);
        StringBuilder hex = new StringBuilder();
        for (byte b : random) {
            hex.append(String.format("%02x", b));
        }
        return handlerName + "-" + hostname + "-" + pid + "-" + hex;
    }
}
