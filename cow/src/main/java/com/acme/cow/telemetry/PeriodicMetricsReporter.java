package com.acme.cow.telemetry;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logs a JSON snapshot of one container's counters at a fixed interval.
 */
public final class PeriodicMetricsReporter implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PeriodicMetricsReporter.class.getName());

    private final String containerName;
    private final AtomicCowMetrics metrics;
    private final ScheduledExecutorService executor;
    private final long intervalSeconds;

    public PeriodicMetricsReporter(String containerName, AtomicCowMetrics metrics, long intervalSeconds) {
        this.containerName = Objects.requireNonNull(containerName, "containerName");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.intervalSeconds = Math.max(1L, intervalSeconds);
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cow-metrics-" + containerName);
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        executor.scheduleAtFixedRate(this::emit, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    String render() {
        AtomicCowMetrics.Snapshot s = metrics.snapshot();
        try {
            return SnapshotJsonCodec.write(containerName, s);
        } catch (JsonProcessingException e) {
            return containerName + " " + s;
        }
    }

    private void emit() {
        try {
            LOG.info(render());
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Metrics reporter failure for " + containerName, e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
