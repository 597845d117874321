package com.acme.cow.util;

/**
 * Canonical environment variable names read by {@code CopyOnWriteOptions.fromEnv()}.
 */
public final class CowEnvKeys {
    public static final String COW_DRAIN_SPIN_ITERATIONS = "COW_DRAIN_SPIN_ITERATIONS";
    public static final String COW_DRAIN_YIELD_ITERATIONS = "COW_DRAIN_YIELD_ITERATIONS";
    public static final String COW_DRAIN_PARK_NANOS = "COW_DRAIN_PARK_NANOS";

    public static final String COW_METRICS_ENABLED = "COW_METRICS_ENABLED";
    public static final String COW_METRICS_INTERVAL_SECONDS = "COW_METRICS_INTERVAL_SECONDS";

    private CowEnvKeys() {
    }
}
