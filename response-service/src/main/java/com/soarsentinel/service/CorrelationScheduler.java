package com.soarsentinel.service;

import com.soarsentinel.core.correlation.CorrelationCoordinator;
import com.soarsentinel.core.correlation.CorrelationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the correlation coordinator over every organization at a fixed
 * interval, on one daemon thread.
 *
 * <p>
 * Runs never overlap: the next run is scheduled a full interval after the
 * previous one finishes. A failed run is logged and does not cancel the
 * schedule.
 * </p>
 */
public class CorrelationScheduler implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CorrelationScheduler.class);

    private final CorrelationCoordinator coordinator;
    private final Duration interval;
    private ScheduledExecutorService scheduler;

    public CorrelationScheduler(CorrelationCoordinator coordinator, Duration interval) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive, got: " + interval);
        }
    }

    public synchronized void start() {
        if (scheduler != null) {
            throw new IllegalStateException("Correlation scheduler already started");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "correlation-scheduler");
            t.setDaemon(true);
            return t;
        });
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::runOnce, millis, millis, TimeUnit.MILLISECONDS);
        LOG.info("Correlation scheduled every {}", interval);
    }

    /**
     * Analyse every organization now, on the calling thread.
     *
     * @return one result per organization analysed
     */
    public List<CorrelationResult> runOnce() {
        long started = System.nanoTime();
        try {
            List<CorrelationResult> results = coordinator.analyzeAll();
            int suggestions = results.stream().mapToInt(r -> r.getSuggestions().size()).sum();
            LOG.info("Correlation run finished in {} ms: {} organization(s), {} suggestion(s)",
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started), results.size(), suggestions);
            return results;
        } catch (RuntimeException e) {
            // an exception escaping a scheduled task would cancel all later runs
            LOG.error("Correlation run failed: {}", e.getMessage(), e);
            return List.of();
        }
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        scheduler = null;
        LOG.info("Correlation scheduler stopped");
    }

    @Override
    public void close() {
        stop();
    }
}
