package com.ivamare.eventbroker.broker.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically reclaims leases older than the broker's message timeout.
 *
 * <p>Reads reclaim stale leases of their own group already; the sweep covers
 * groups that stopped reading.
 */
public class StaleLeaseSweeper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StaleLeaseSweeper.class);

    private final InlineBroker broker;
    private final Duration interval;
    private ScheduledExecutorService scheduler;

    public StaleLeaseSweeper(InlineBroker broker, Duration interval) {
        this.broker = broker;
        this.interval = interval;
    }

    /**
     * Start sweeping. Does nothing when the interval is zero or negative.
     */
    public synchronized void start() {
        if (scheduler != null || interval == null || interval.isZero() || interval.isNegative()) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "inline-broker-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
        log.info("Stale lease sweep scheduled every {}", interval);
    }

    /**
     * Run one sweep.
     *
     * @return number of reclaimed messages
     */
    public int sweep() {
        try {
            int reclaimed = broker.reclaimStaleLeases();
            if (reclaimed > 0) {
                log.info("Reclaimed {} stale messages", reclaimed);
            }
            return reclaimed;
        } catch (RuntimeException e) {
            log.error("Stale lease sweep failed", e);
            return 0;
        }
    }

    public synchronized boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}
