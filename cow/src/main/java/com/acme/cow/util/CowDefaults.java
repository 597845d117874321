package com.acme.cow.util;

/**
 * Default tuning constants, used when the corresponding environment variable is not set.
 */
public final class CowDefaults {

    // ---- Drain wait ----
    public static final int DEFAULT_DRAIN_SPIN_ITERATIONS = 1024;
    public static final int DEFAULT_DRAIN_YIELD_ITERATIONS = 64;
    public static final long DEFAULT_DRAIN_PARK_NANOS = 1_000L;

    public static final int MAX_DRAIN_ITERATIONS = 1_000_000;
    public static final long MAX_DRAIN_PARK_NANOS = 10_000_000L;

    // ---- Metrics reporter ----
    public static final boolean DEFAULT_METRICS_ENABLED = false;
    public static final int DEFAULT_METRICS_INTERVAL_SECONDS = 30;
    public static final int MAX_METRICS_INTERVAL_SECONDS = 3_600;

    private CowDefaults() {
    }
}
