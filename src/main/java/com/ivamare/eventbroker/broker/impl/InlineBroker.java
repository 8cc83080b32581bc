package com.ivamare.eventbroker.broker.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventbroker.broker.AbstractBroker;
import com.ivamare.eventbroker.broker.BrokerCapabilities;
import com.ivamare.eventbroker.broker.BrokerCapability;
import com.ivamare.eventbroker.broker.BrokerSettings;
import com.ivamare.eventbroker.broker.CapabilityTier;
import com.ivamare.eventbroker.model.BrokerInfo;
import com.ivamare.eventbroker.model.BrokerMessage;
import com.ivamare.eventbroker.model.ConsumerGroupInfo;
import com.ivamare.eventbroker.model.DeadLetterEntry;
import com.ivamare.eventbroker.model.OperationState;
import com.ivamare.eventbroker.model.RetryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process broker keeping all streams, cursors, leases, retry queues and
 * dead-letter queues in memory.
 *
 * <p>All state is guarded by a single lock. Blocking reads wait on a condition
 * of that lock which is signalled on every publish and re-insert.
 *
 * <p>Redelivered messages are re-inserted into the stream at the owning group's
 * cursor and are visible to that group only. Cursors of other groups at or
 * beyond the insertion point move forward by one; groups behind it step over
 * the copy when they reach it.
 *
 * <p>State is lost when the instance is discarded.
 */
public class InlineBroker extends AbstractBroker {

    private static final Logger log = LoggerFactory.getLogger(InlineBroker.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final BrokerCapabilities CAPABILITIES = CapabilityTier.ORDERED_MESSAGING.capabilities()
        .with(BrokerCapability.BLOCKING_READ, BrokerCapability.DEAD_LETTER_QUEUE);

    private final ObjectMapper objectMapper;
    private final BrokerSettings settings;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition messageAvailable = lock.newCondition();

    private final Map<String, List<StoredMessage>> messages = new LinkedHashMap<>();
    private final Map<GroupKey, Integer> positions = new LinkedHashMap<>();
    private final Map<String, Instant> groupCreatedAt = new LinkedHashMap<>();
    private final Map<String, Set<String>> groupConsumers = new HashMap<>();
    private final Map<GroupKey, Map<String, Lease>> inFlight = new HashMap<>();
    private final Map<GroupKey, List<RetryEntry>> retryQueues = new HashMap<>();
    private final Map<GroupKey, List<DeadLetterEntry>> deadLetters = new HashMap<>();
    private final Map<GroupKey, Map<String, Integer>> retryCounts = new HashMap<>();
    private final Map<String, Set<String>> ownership = new HashMap<>();
    private final Map<String, Map<String, TrackedState>> operationStates = new HashMap<>();

    public InlineBroker(ObjectMapper objectMapper) {
        this(objectMapper, BrokerSettings.defaults(), Clock.systemUTC());
    }

    public InlineBroker(ObjectMapper objectMapper, BrokerSettings settings, Clock clock) {
        super(clock);
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    @Override
    public BrokerCapabilities capabilities() {
        return CAPABILITIES;
    }

    public BrokerSettings settings() {
        return settings;
    }

    // --- Publishing ---

    @Override
    protected String doPublish(String stream, Map<String, Object> payload) {
        String identifier = UUID.randomUUID().toString();
        Map<String, Object> copy = copyOf(payload);

        lock.lock();
        try {
            messages.computeIfAbsent(stream, s -> new ArrayList<>()).add(new StoredMessage(identifier, copy, null));
            messageAvailable.signalAll();
        } finally {
            lock.unlock();
        }

        log.debug("Published message {} to stream {}", identifier, stream);
        return identifier;
    }

    // --- Reading ---

    @Override
    protected Optional<BrokerMessage> doGetNext(String stream, String consumerGroup) {
        lock.lock();
        try {
            return nextLocked(stream, consumerGroup);
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected List<BrokerMessage> doReadBlocking(String stream, String consumerGroup, String consumerName,
                                                 Duration timeout, int count) {
        long deadline = System.nanoTime() + timeout.toNanos();

        lock.lock();
        try {
            if (consumerName != null) {
                groupConsumers.computeIfAbsent(consumerGroup, g -> new LinkedHashSet<>()).add(consumerName);
            }

            while (true) {
                List<BrokerMessage> batch = new ArrayList<>();
                while (batch.size() < count) {
                    Optional<BrokerMessage> next = nextLocked(stream, consumerGroup);
                    if (next.isEmpty()) {
                        break;
                    }
                    batch.add(next.get());
                }
                if (!batch.isEmpty()) {
                    return batch;
                }

                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return List.of();
                }

                // Wake up for the earliest scheduled redelivery even without a publish
                Instant nextRetry = earliestRetry(new GroupKey(stream, consumerGroup));
                if (nextRetry != null) {
                    Duration untilRetry = Duration.between(clock.instant(), nextRetry);
                    if (untilRetry.compareTo(Duration.ofNanos(remaining)) < 0) {
                        remaining = Math.max(untilRetry.toNanos(), TimeUnit.MILLISECONDS.toNanos(1));
                    }
                }

                messageAvailable.awaitNanos(remaining);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        } finally {
            lock.unlock();
        }
    }

    private Optional<BrokerMessage> nextLocked(String stream, String consumerGroup) {
        GroupKey key = new GroupKey(stream, consumerGroup);
        registerGroupLocked(key);

        cleanupStaleMessagesLocked(consumerGroup, settings.messageTimeout());
        requeueDueRetriesLocked(key);

        List<StoredMessage> streamMessages = messages.getOrDefault(stream, List.of());
        int position = positions.get(key);
        while (position < streamMessages.size() && !streamMessages.get(position).visibleTo(consumerGroup)) {
            position++;
        }
        if (position >= streamMessages.size()) {
            positions.put(key, position);
            return Optional.empty();
        }

        StoredMessage message = streamMessages.get(position);
        positions.put(key, position + 1);

        inFlight.computeIfAbsent(key, k -> new LinkedHashMap<>())
            .put(message.identifier(), new Lease(message.payload(), clock.instant()));
        ownership.computeIfAbsent(message.identifier(), id -> new LinkedHashSet<>()).add(consumerGroup);
        storeOperationState(consumerGroup, message.identifier(), OperationState.PENDING);

        return Optional.of(new BrokerMessage(message.identifier(), copyOf(message.payload())));
    }

    // --- Consumer groups ---

    @Override
    public void ensureGroup(String consumerGroup, String stream) {
        if (isBlank(consumerGroup) || isBlank(stream)) {
            throw new IllegalArgumentException("Consumer group and stream must not be blank");
        }
        lock.lock();
        try {
            registerGroupLocked(new GroupKey(stream, consumerGroup));
        } finally {
            lock.unlock();
        }
    }

    private void registerGroupLocked(GroupKey key) {
        messages.computeIfAbsent(key.stream(), s -> new ArrayList<>());
        if (positions.putIfAbsent(key, 0) == null) {
            groupCreatedAt.putIfAbsent(key.group(), clock.instant());
            log.debug("Registered consumer group {} on stream {}", key.group(), key.stream());
        }
    }

    // --- Acknowledgement ---

    @Override
    public boolean ack(String stream, String identifier, String consumerGroup) {
        if (isBlank(stream) || isBlank(identifier) || isBlank(consumerGroup)) {
            return false;
        }

        lock.lock();
        try {
            cleanupExpiredOperationStatesLocked();

            GroupKey key = new GroupKey(stream, consumerGroup);
            if (!isOwnedLocked(key, identifier)) {
                log.warn("Ack rejected: message {} not owned by group {} on {}", identifier, consumerGroup, stream);
                return false;
            }

            Optional<OperationState> state = operationState(consumerGroup, identifier);
            if (state.isPresent() && state.get() == OperationState.ACKNOWLEDGED) {
                log.warn("Message {} already acknowledged by group {}", identifier, consumerGroup);
                return false;
            }

            Map<String, Lease> leases = inFlight.get(key);
            if (leases != null && leases.remove(identifier) != null) {
                completeLocked(key, identifier, OperationState.ACKNOWLEDGED);
                log.debug("Acknowledged message {} for group {}", identifier, consumerGroup);
                return true;
            }

            List<RetryEntry> queue = retryQueues.get(key);
            if (queue != null && queue.removeIf(entry -> entry.identifier().equals(identifier))) {
                completeLocked(key, identifier, OperationState.ACKNOWLEDGED);
                log.debug("Acknowledged retry-queued message {} for group {}", identifier, consumerGroup);
                return true;
            }

            log.warn("Ack rejected: message {} is not in flight for group {}", identifier, consumerGroup);
            return false;
        } catch (RuntimeException e) {
            log.error("Error acknowledging message {} for group {}", identifier, consumerGroup, e);
            clearOperationState(consumerGroup, identifier);
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean nack(String stream, String identifier, String consumerGroup) {
        if (isBlank(stream) || isBlank(identifier) || isBlank(consumerGroup)) {
            return false;
        }

        lock.lock();
        try {
            cleanupExpiredOperationStatesLocked();

            GroupKey key = new GroupKey(stream, consumerGroup);
            if (!isOwnedLocked(key, identifier)) {
                log.warn("Nack rejected: message {} not owned by group {} on {}", identifier, consumerGroup, stream);
                return false;
            }

            Optional<OperationState> state = operationState(consumerGroup, identifier);
            if (state.isPresent() && state.get() == OperationState.NACKED) {
                log.warn("Message {} already nacked by group {}", identifier, consumerGroup);
                return false;
            }

            Map<String, Lease> leases = inFlight.get(key);
            Lease lease = leases != null ? leases.remove(identifier) : null;
            if (lease == null) {
                log.warn("Nack rejected: message {} is not in flight for group {}", identifier, consumerGroup);
                return false;
            }

            int retryCount = retryCounts.computeIfAbsent(key, k -> new HashMap<>()).merge(identifier, 1, Integer::sum);

            if (settings.retryPolicy().shouldRetry(retryCount)) {
                Instant nextRetryAt = clock.instant().plus(settings.retryPolicy().backoffFor(retryCount));
                retryQueues.computeIfAbsent(key, k -> new ArrayList<>())
                    .add(new RetryEntry(identifier, lease.payload(), retryCount, nextRetryAt));
                storeOperationState(consumerGroup, identifier, OperationState.NACKED);
                log.warn("Message {} nacked by group {}, retry {}/{} scheduled at {}",
                    identifier, consumerGroup, retryCount, settings.retryPolicy().maxRetries(), nextRetryAt);
                return true;
            }

            if (settings.enableDlq()) {
                deadLetters.computeIfAbsent(key, k -> new ArrayList<>())
                    .add(new DeadLetterEntry(identifier, lease.payload(), DeadLetterEntry.REASON_MAX_RETRIES,
                        clock.instant()));
                log.error("Message {} exceeded max retries ({}) for group {}, moved to DLQ",
                    identifier, settings.retryPolicy().maxRetries(), consumerGroup);
            } else {
                log.error("Message {} exceeded max retries ({}) for group {}, discarded",
                    identifier, settings.retryPolicy().maxRetries(), consumerGroup);
            }
            completeLocked(key, identifier, OperationState.NACKED);
            return true;
        } catch (RuntimeException e) {
            log.error("Error nacking message {} for group {}", identifier, consumerGroup, e);
            clearOperationState(consumerGroup, identifier);
            return false;
        } finally {
            lock.unlock();
        }
    }

    private boolean isOwnedLocked(GroupKey key, String identifier) {
        if (!positions.containsKey(key)) {
            return false;
        }
        Set<String> owners = ownership.get(identifier);
        return owners != null && owners.contains(key.group());
    }

    private void completeLocked(GroupKey key, String identifier, OperationState finalState) {
        Map<String, Integer> counts = retryCounts.get(key);
        if (counts != null) {
            counts.remove(identifier);
        }
        releaseOwnershipLocked(identifier, key.group());
        storeOperationState(key.group(), identifier, finalState);
    }

    private void releaseOwnershipLocked(String identifier, String consumerGroup) {
        Set<String> owners = ownership.get(identifier);
        if (owners == null) {
            return;
        }
        owners.remove(consumerGroup);
        if (owners.isEmpty()) {
            ownership.remove(identifier);
        }
    }

    /**
     * Current retry count of a message within a consumer group.
     *
     * @param stream Stream name
     * @param consumerGroup Consumer group name
     * @param identifier Message identifier
     * @return number of nacks so far, 0 if never nacked
     */
    public int getRetryCount(String stream, String consumerGroup, String identifier) {
        lock.lock();
        try {
            return retryCounts.getOrDefault(new GroupKey(stream, consumerGroup), Map.of())
                .getOrDefault(identifier, 0);
        } finally {
            lock.unlock();
        }
    }

    // --- Retry queue ---

    private void requeueDueRetriesLocked(GroupKey key) {
        List<RetryEntry> queue = retryQueues.get(key);
        if (queue == null || queue.isEmpty()) {
            return;
        }

        Instant now = clock.instant();
        List<RetryEntry> due = new ArrayList<>();
        Iterator<RetryEntry> it = queue.iterator();
        while (it.hasNext()) {
            RetryEntry entry = it.next();
            if (entry.isDue(now)) {
                due.add(entry);
                it.remove();
            }
        }

        for (int i = 0; i < due.size(); i++) {
            RetryEntry entry = due.get(i);
            insertAtCursorLocked(key, new StoredMessage(entry.identifier(), entry.payload(), key.group()), i);
            log.debug("Requeued message {} for group {} (retry {})",
                entry.identifier(), key.group(), entry.retryCount());
        }
    }

    /**
     * Insert a message at {@code cursor + offset} of the group's stream.
     */
    private void insertAtCursorLocked(GroupKey key, StoredMessage message, int offset) {
        List<StoredMessage> streamMessages = messages.computeIfAbsent(key.stream(), s -> new ArrayList<>());
        int insertAt = Math.min(positions.getOrDefault(key, 0) + offset, streamMessages.size());
        streamMessages.add(insertAt, message);

        for (Map.Entry<GroupKey, Integer> entry : positions.entrySet()) {
            GroupKey other = entry.getKey();
            if (!other.equals(key) && other.stream().equals(key.stream()) && entry.getValue() >= insertAt) {
                entry.setValue(entry.getValue() + 1);
            }
        }
        messageAvailable.signalAll();
    }

    private Instant earliestRetry(GroupKey key) {
        List<RetryEntry> queue = retryQueues.get(key);
        if (queue == null) {
            return null;
        }
        Instant earliest = null;
        for (RetryEntry entry : queue) {
            if (earliest == null || entry.nextRetryAt().isBefore(earliest)) {
                earliest = entry.nextRetryAt();
            }
        }
        return earliest;
    }

    // --- Stale lease reclamation ---

    /**
     * Reclaim leases of a consumer group older than {@code timeout}.
     *
     * <p>Reclaimed messages go to the DLQ with reason {@code timeout} when the DLQ
     * is enabled, otherwise they are dropped.
     *
     * @param consumerGroup Consumer group name
     * @param timeout Maximum lease age
     * @return number of reclaimed messages
     */
    public int cleanupStaleMessages(String consumerGroup, Duration timeout) {
        lock.lock();
        try {
            return cleanupStaleMessagesLocked(consumerGroup, timeout);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reclaim stale leases of every consumer group using the configured message timeout.
     *
     * @return number of reclaimed messages
     */
    public int reclaimStaleLeases() {
        lock.lock();
        try {
            int reclaimed = 0;
            for (String group : new ArrayList<>(groupCreatedAt.keySet())) {
                reclaimed += cleanupStaleMessagesLocked(group, settings.messageTimeout());
            }
            return reclaimed;
        } finally {
            lock.unlock();
        }
    }

    private int cleanupStaleMessagesLocked(String consumerGroup, Duration timeout) {
        Instant cutoff = clock.instant().minus(timeout);
        int reclaimed = 0;

        for (Map.Entry<GroupKey, Map<String, Lease>> entry : inFlight.entrySet()) {
            GroupKey key = entry.getKey();
            if (!key.group().equals(consumerGroup)) {
                continue;
            }

            Iterator<Map.Entry<String, Lease>> it = entry.getValue().entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, Lease> lease = it.next();
                if (!lease.getValue().leasedAt().isBefore(cutoff)) {
                    continue;
                }
                String identifier = lease.getKey();
                it.remove();

                if (settings.enableDlq()) {
                    deadLetters.computeIfAbsent(key, k -> new ArrayList<>())
                        .add(new DeadLetterEntry(identifier, lease.getValue().payload(),
                            DeadLetterEntry.REASON_TIMEOUT, clock.instant()));
                    log.warn("Message {} timed out for group {} on {}, moved to DLQ",
                        identifier, consumerGroup, key.stream());
                } else {
                    log.warn("Message {} timed out for group {} on {}, discarded",
                        identifier, consumerGroup, key.stream());
                }

                Map<String, Integer> counts = retryCounts.get(key);
                if (counts != null) {
                    counts.remove(identifier);
                }
                releaseOwnershipLocked(identifier, consumerGroup);
                clearOperationState(consumerGroup, identifier);
                reclaimed++;
            }
        }
        return reclaimed;
    }

    // --- Dead-letter queue ---

    @Override
    public Map<String, List<DeadLetterEntry>> getDlqMessages(String consumerGroup, String stream) {
        lock.lock();
        try {
            Map<String, List<DeadLetterEntry>> result = new LinkedHashMap<>();
            if (stream != null) {
                result.put(stream, List.copyOf(
                    deadLetters.getOrDefault(new GroupKey(stream, consumerGroup), List.of())));
                return result;
            }
            for (Map.Entry<GroupKey, List<DeadLetterEntry>> entry : deadLetters.entrySet()) {
                if (entry.getKey().group().equals(consumerGroup) && !entry.getValue().isEmpty()) {
                    result.put(entry.getKey().stream(), List.copyOf(entry.getValue()));
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean reprocessDlqMessage(String identifier, String consumerGroup, String stream) {
        if (isBlank(identifier) || isBlank(consumerGroup) || isBlank(stream)) {
            return false;
        }

        lock.lock();
        try {
            GroupKey key = new GroupKey(stream, consumerGroup);
            List<DeadLetterEntry> entries = deadLetters.get(key);
            if (entries == null) {
                return false;
            }

            DeadLetterEntry found = null;
            for (DeadLetterEntry entry : entries) {
                if (entry.identifier().equals(identifier)) {
                    found = entry;
                    break;
                }
            }
            if (found == null) {
                return false;
            }

            entries.remove(found);
            registerGroupLocked(key);
            insertAtCursorLocked(key, new StoredMessage(found.identifier(), found.payload(), key.group()), 0);

            Map<String, Integer> counts = retryCounts.get(key);
            if (counts != null) {
                counts.remove(identifier);
            }
            clearOperationState(consumerGroup, identifier);

            log.info("Reprocessing DLQ message {} for group {} on {}", identifier, consumerGroup, stream);
            return true;
        } catch (RuntimeException e) {
            log.error("Error reprocessing DLQ message {} for group {}", identifier, consumerGroup, e);
            return false;
        } finally {
            lock.unlock();
        }
    }

    // --- Operation state ---

    /**
     * Idempotency state of a message for a consumer group.
     *
     * @param consumerGroup Consumer group name
     * @param identifier Message identifier
     * @return the state, or empty if none is tracked
     */
    public Optional<OperationState> operationState(String consumerGroup, String identifier) {
        lock.lock();
        try {
            TrackedState tracked = operationStates.getOrDefault(consumerGroup, Map.of()).get(identifier);
            return tracked != null ? Optional.of(tracked.state()) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    private void storeOperationState(String consumerGroup, String identifier, OperationState state) {
        operationStates.computeIfAbsent(consumerGroup, g -> new HashMap<>())
            .put(identifier, new TrackedState(state, clock.instant()));
    }

    private void clearOperationState(String consumerGroup, String identifier) {
        Map<String, TrackedState> states = operationStates.get(consumerGroup);
        if (states != null) {
            states.remove(identifier);
        }
    }

    private void cleanupExpiredOperationStatesLocked() {
        Instant cutoff = clock.instant().minus(settings.operationStateTtl());
        for (Map<String, TrackedState> states : operationStates.values()) {
            states.values().removeIf(tracked -> tracked.updatedAt().isBefore(cutoff));
        }
    }

    // --- Connection and health ---

    @Override
    protected boolean doEnsureConnection() {
        return true;
    }

    @Override
    protected boolean doPing() {
        return true;
    }

    @Override
    protected Map<String, Object> healthDetails() {
        lock.lock();
        try {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("healthy", true);
            details.put("message_counts", messageCountsLocked());
            details.put("streams", streamsLocked());
            details.put("consumer_groups", consumerGroupsLocked());
            details.put("memory_estimate_bytes", memoryEstimateLocked());

            Map<String, Object> configuration = new LinkedHashMap<>();
            configuration.put("max_retries", settings.retryPolicy().maxRetries());
            configuration.put("retry_delay", settings.retryPolicy().retryDelay().toMillis() / 1000.0);
            configuration.put("message_timeout", settings.messageTimeout().toMillis() / 1000.0);
            configuration.put("enable_dlq", settings.enableDlq());
            details.put("configuration", configuration);
            return details;
        } finally {
            lock.unlock();
        }
    }

    private Map<String, Object> messageCountsLocked() {
        Map<String, Object> counts = new LinkedHashMap<>();
        try {
            counts.put("total_messages", messages.values().stream().mapToInt(List::size).sum());
            counts.put("in_flight", inFlight.values().stream().mapToInt(Map::size).sum());
            counts.put("failed", retryQueues.values().stream().mapToInt(List::size).sum());
            counts.put("dlq", deadLetters.values().stream().mapToInt(List::size).sum());
        } catch (RuntimeException e) {
            log.warn("Failed to count messages: {}", e.getMessage());
            counts.put("total_messages", 0);
            counts.put("in_flight", 0);
            counts.put("failed", 0);
            counts.put("dlq", 0);
        }
        return counts;
    }

    private Map<String, Object> streamsLocked() {
        Map<String, Object> streams = new LinkedHashMap<>();
        List<String> names = new ArrayList<>(new TreeSet<>(messages.keySet()));
        streams.put("count", names.size());
        streams.put("names", names);
        return streams;
    }

    private Map<String, Object> consumerGroupsLocked() {
        Map<String, Object> groups = new LinkedHashMap<>();
        List<String> names = new ArrayList<>(new TreeSet<>(groupCreatedAt.keySet()));
        groups.put("count", names.size());
        groups.put("names", names);
        return groups;
    }

    private long memoryEstimateLocked() {
        long bytes = 0;
        try {
            for (List<StoredMessage> streamMessages : messages.values()) {
                for (StoredMessage message : streamMessages) {
                    bytes += message.identifier().length();
                    bytes += objectMapper.writeValueAsBytes(message.payload()).length;
                }
            }
        } catch (JsonProcessingException e) {
            log.warn("Failed to estimate memory usage: {}", e.getMessage());
            return 0;
        }
        return bytes;
    }

    @Override
    public BrokerInfo info() {
        lock.lock();
        try {
            Map<String, ConsumerGroupInfo> groups = new LinkedHashMap<>();
            for (Map.Entry<String, Instant> group : groupCreatedAt.entrySet()) {
                String name = group.getKey();
                Map<String, Integer> inFlightCounts = new LinkedHashMap<>();
                Map<String, Integer> failedCounts = new LinkedHashMap<>();
                Map<String, Integer> dlqCounts = new LinkedHashMap<>();

                for (GroupKey key : positions.keySet()) {
                    if (!key.group().equals(name)) {
                        continue;
                    }
                    inFlightCounts.put(key.stream(), inFlight.getOrDefault(key, Map.of()).size());
                    failedCounts.put(key.stream(), retryQueues.getOrDefault(key, List.of()).size());
                    dlqCounts.put(key.stream(), deadLetters.getOrDefault(key, List.of()).size());
                }

                groups.put(name, new ConsumerGroupInfo(
                    name,
                    groupConsumers.getOrDefault(name, Set.of()),
                    group.getValue(),
                    inFlightCounts,
                    failedCounts,
                    dlqCounts
                ));
            }
            return new BrokerInfo(groups);
        } finally {
            lock.unlock();
        }
    }

    // --- Inspection ---

    /**
     * Number of messages currently leased to a group on a stream.
     */
    public int inFlightCount(String stream, String consumerGroup) {
        lock.lock();
        try {
            return inFlight.getOrDefault(new GroupKey(stream, consumerGroup), Map.of()).size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Messages of a group waiting for redelivery, in nack order.
     */
    public List<RetryEntry> retryQueue(String stream, String consumerGroup) {
        lock.lock();
        try {
            return List.copyOf(retryQueues.getOrDefault(new GroupKey(stream, consumerGroup), List.of()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cursor of a group on a stream, or -1 if the group is not registered there.
     */
    public int position(String stream, String consumerGroup) {
        lock.lock();
        try {
            return positions.getOrDefault(new GroupKey(stream, consumerGroup), -1);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of stored messages of a stream, including re-inserted copies.
     */
    public int streamLength(String stream) {
        lock.lock();
        try {
            return messages.getOrDefault(stream, List.of()).size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop all streams, groups and delivery state.
     */
    public void dataReset() {
        lock.lock();
        try {
            messages.clear();
            positions.clear();
            groupCreatedAt.clear();
            groupConsumers.clear();
            inFlight.clear();
            retryQueues.clear();
            deadLetters.clear();
            retryCounts.clear();
            ownership.clear();
            operationStates.clear();
            log.info("Inline broker state reset");
        } finally {
            lock.unlock();
        }
    }

    private Map<String, Object> copyOf(Map<String, Object> payload) {
        try {
            return objectMapper.readValue(objectMapper.writeValueAsBytes(payload), MAP_TYPE);
        } catch (IOException e) {
            throw new IllegalArgumentException("Payload is not JSON serializable", e);
        }
    }

    private record GroupKey(String stream, String group) {}

    private record Lease(Map<String, Object> payload, Instant leasedAt) {}

    private record TrackedState(OperationState state, Instant updatedAt) {}

    /**
     * A stream entry. Redelivered copies carry the group they were re-inserted for.
     */
    private record StoredMessage(String identifier, Map<String, Object> payload, String owner) {

        boolean visibleTo(String consumerGroup) {
            return owner == null || owner.equals(consumerGroup);
        }
    }
}
