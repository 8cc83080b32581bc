package com.ivamare.eventbroker.broker;

import com.ivamare.eventbroker.exception.ConnectionExceptionClassifier;
import com.ivamare.eventbroker.model.BrokerHealthStats;
import com.ivamare.eventbroker.model.BrokerHealthStatus;
import com.ivamare.eventbroker.model.BrokerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Base class for brokers.
 *
 * <p>Public read and write operations delegate to {@code do*} template methods.
 * A failure classified as a connection error by {@link ConnectionExceptionClassifier}
 * triggers one {@link #ensureConnection()} and one retry of the operation; if
 * reconnecting fails, the original exception is rethrown. Other failures propagate
 * unchanged.
 */
public abstract class AbstractBroker implements Broker {

    private static final Logger log = LoggerFactory.getLogger(AbstractBroker.class);

    protected final Clock clock;
    private final Instant startedAt;

    private volatile Double lastPingMs;
    private volatile boolean lastPingSuccess;

    protected AbstractBroker(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    // --- Template methods ---

    protected abstract String doPublish(String stream, Map<String, Object> payload);

    protected abstract Optional<BrokerMessage> doGetNext(String stream, String consumerGroup);

    /**
     * Blocking read. Only called when the broker declares {@link BrokerCapability#BLOCKING_READ}.
     */
    protected List<BrokerMessage> doReadBlocking(String stream, String consumerGroup, String consumerName,
                                                 Duration timeout, int count) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " does not support blocking reads");
    }

    protected abstract boolean doEnsureConnection();

    protected abstract boolean doPing();

    /**
     * Backend specific health details. Must contain a boolean {@code healthy} entry.
     */
    protected abstract Map<String, Object> healthDetails();

    // --- Public operations ---

    @Override
    public String publish(String stream, Map<String, Object> payload) {
        if (isBlank(stream)) {
            throw new IllegalArgumentException("Stream name must not be blank");
        }
        if (payload == null) {
            throw new IllegalArgumentException("Payload must not be null");
        }
        return executeWithRecovery("publish", () -> doPublish(stream, payload));
    }

    @Override
    public Optional<BrokerMessage> getNext(String stream, String consumerGroup) {
        if (isBlank(stream) || isBlank(consumerGroup)) {
            return Optional.empty();
        }
        return executeWithRecovery("get_next", () -> doGetNext(stream, consumerGroup));
    }

    @Override
    public List<BrokerMessage> read(String stream, String consumerGroup, int count) {
        List<BrokerMessage> messages = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Optional<BrokerMessage> next = getNext(stream, consumerGroup);
            if (next.isEmpty()) {
                break;
            }
            messages.add(next.get());
        }
        return messages;
    }

    @Override
    public List<BrokerMessage> readBlocking(String stream, String consumerGroup, String consumerName,
                                            Duration timeout, int count) {
        if (isBlank(stream) || isBlank(consumerGroup) || count <= 0) {
            return List.of();
        }
        if (!hasCapability(BrokerCapability.BLOCKING_READ)) {
            return read(stream, consumerGroup, count);
        }
        Duration wait = timeout == null || timeout.isNegative() ? Duration.ZERO : timeout;
        return executeWithRecovery("read_blocking",
            () -> doReadBlocking(stream, consumerGroup, consumerName, wait, count));
    }

    @Override
    public boolean ensureConnection() {
        try {
            return doEnsureConnection();
        } catch (RuntimeException e) {
            log.error("Failed to ensure broker connection: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean ping() {
        long start = System.nanoTime();
        try {
            boolean success = doPing();
            lastPingMs = (System.nanoTime() - start) / 1_000_000.0;
            lastPingSuccess = success;
            return success;
        } catch (RuntimeException e) {
            log.warn("Broker ping failed: {}", e.getMessage());
            lastPingMs = null;
            lastPingSuccess = false;
            return false;
        }
    }

    @Override
    public BrokerHealthStats healthStats() {
        boolean connected = ping();

        Map<String, Object> details;
        try {
            details = healthDetails();
        } catch (RuntimeException e) {
            log.error("Failed to collect broker health details", e);
            details = new LinkedHashMap<>();
            details.put("healthy", false);
            details.put("error", String.valueOf(e.getMessage()));
        }

        BrokerHealthStatus status;
        if (!connected) {
            status = BrokerHealthStatus.UNHEALTHY;
        } else if (Boolean.FALSE.equals(details.get("healthy"))) {
            status = BrokerHealthStatus.DEGRADED;
        } else {
            status = BrokerHealthStatus.HEALTHY;
        }

        Double pingMs = lastPingMs;
        return new BrokerHealthStats(
            status,
            connected,
            pingMs != null ? pingMs : 0.0,
            Duration.between(startedAt, clock.instant()).toMillis() / 1000.0,
            details
        );
    }

    /**
     * Duration of the last successful ping.
     *
     * @return milliseconds, or null if the last ping failed or none was made
     */
    public Double lastPingMs() {
        return lastPingMs;
    }

    public boolean lastPingSuccess() {
        return lastPingSuccess;
    }

    // --- Connection resilience ---

    /**
     * Run an operation, reconnecting and retrying once on a connection error.
     *
     * @param operation operation name for logging
     * @param action the operation
     * @return the operation's result
     */
    protected <T> T executeWithRecovery(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            String reason = ConnectionExceptionClassifier.getConnectionReason(e);
            if (reason == null) {
                throw e;
            }

            log.warn("Connection error during {} ({}): {}, attempting reconnect", operation, reason, e.getMessage());
            if (!ensureConnection()) {
                log.error("Reconnect failed during {}", operation);
                throw e;
            }

            log.info("Reconnected, retrying {}", operation);
            return action.get();
        }
    }

    protected static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
