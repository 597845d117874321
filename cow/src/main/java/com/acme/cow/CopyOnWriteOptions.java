package com.acme.cow;

import com.acme.cow.memory.ValueDisposer;
import com.acme.cow.telemetry.AtomicCowMetrics;
import com.acme.cow.telemetry.CowMetrics;
import com.acme.cow.telemetry.NoopCowMetrics;
import com.acme.cow.util.CowDefaults;
import com.acme.cow.util.CowEnvKeys;
import com.acme.cow.util.EnvVars;
import com.acme.cow.word.DrainPolicy;

import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Construction-time settings of a {@link CopyOnWrite}.
 *
 * @param name                         label used in logs and metric reports
 * @param drainPolicy                  how writers wait for stale readers
 * @param metrics                      counters sink
 * @param metricsReportIntervalSeconds period of the JSON metrics log line; 0 disables it
 *                                     (only honoured with {@link AtomicCowMetrics})
 * @param disposer                     runs once per value when its cell is deallocated
 * @param defaultFactory               builds the fresh value for {@code reset} calls that
 *                                     pass no factory; may be {@code null}
 */
public record CopyOnWriteOptions<T>(String name,
                                    DrainPolicy drainPolicy,
                                    CowMetrics metrics,
                                    long metricsReportIntervalSeconds,
                                    ValueDisposer<? super T> disposer,
                                    Supplier<? extends T> defaultFactory) {

    public CopyOnWriteOptions {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(drainPolicy, "drainPolicy");
        Objects.requireNonNull(metrics, "metrics");
        Objects.requireNonNull(disposer, "disposer");
        metricsReportIntervalSeconds = Math.max(0L, metricsReportIntervalSeconds);
    }

    public static <T> CopyOnWriteOptions<T> defaults() {
        return new CopyOnWriteOptions<>(
            "cow",
            DrainPolicy.DEFAULT,
            NoopCowMetrics.INSTANCE,
            0L,
            ValueDisposer.releasingReferenceCounted(),
            null
        );
    }

    public static <T> CopyOnWriteOptions<T> fromEnv() {
        return fromEnv(System.getenv());
    }

    public static <T> CopyOnWriteOptions<T> fromEnv(Map<String, String> env) {
        CopyOnWriteOptions<T> base = CopyOnWriteOptions.<T>defaults().withDrainPolicy(DrainPolicy.fromEnv(env));
        if (!EnvVars.getBoolean(env, CowEnvKeys.COW_METRICS_ENABLED, CowDefaults.DEFAULT_METRICS_ENABLED)) {
            return base;
        }
        int interval = EnvVars.getIntClamped(env, CowEnvKeys.COW_METRICS_INTERVAL_SECONDS,
            CowDefaults.DEFAULT_METRICS_INTERVAL_SECONDS, 1, CowDefaults.MAX_METRICS_INTERVAL_SECONDS);
        return base.withMetrics(new AtomicCowMetrics()).withMetricsReportInterval(interval);
    }

    public CopyOnWriteOptions<T> withName(String newName) {
        return new CopyOnWriteOptions<>(newName, drainPolicy, metrics, metricsReportIntervalSeconds, disposer, defaultFactory);
    }

    public CopyOnWriteOptions<T> withDrainPolicy(DrainPolicy policy) {
        return new CopyOnWriteOptions<>(name, policy, metrics, metricsReportIntervalSeconds, disposer, defaultFactory);
    }

    public CopyOnWriteOptions<T> withMetrics(CowMetrics newMetrics) {
        return new CopyOnWriteOptions<>(name, drainPolicy, newMetrics, metricsReportIntervalSeconds, disposer, defaultFactory);
    }

    public CopyOnWriteOptions<T> withMetricsReportInterval(long seconds) {
        return new CopyOnWriteOptions<>(name, drainPolicy, metrics, seconds, disposer, defaultFactory);
    }

    public CopyOnWriteOptions<T> withDisposer(ValueDisposer<? super T> newDisposer) {
        return new CopyOnWriteOptions<>(name, drainPolicy, metrics, metricsReportIntervalSeconds, newDisposer, defaultFactory);
    }

    public CopyOnWriteOptions<T> withDefaultFactory(Supplier<? extends T> factory) {
        return new CopyOnWriteOptions<>(name, drainPolicy, metrics, metricsReportIntervalSeconds, disposer, factory);
    }
}
