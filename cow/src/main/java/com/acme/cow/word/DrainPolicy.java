package com.acme.cow.word;

import com.acme.cow.util.CowDefaults;
import com.acme.cow.util.CowEnvKeys;
import com.acme.cow.util.EnvVars;

import java.util.Map;
import java.util.concurrent.locks.LockSupport;

/**
 * How a writer idles while stale readers finish registering.
 *
 * <p>Iterations below {@code spinIterations} call {@link Thread#onSpinWait()}, the next
 * {@code yieldIterations} call {@link Thread#yield()}, and every later iteration parks
 * for {@code parkNanos} (or keeps spinning when {@code parkNanos} is 0).</p>
 */
public record DrainPolicy(int spinIterations, int yieldIterations, long parkNanos) {

    /** Unbounded busy spin. */
    public static final DrainPolicy BUSY_SPIN = new DrainPolicy(Integer.MAX_VALUE, 0, 0L);

    public static final DrainPolicy DEFAULT = new DrainPolicy(
        CowDefaults.DEFAULT_DRAIN_SPIN_ITERATIONS,
        CowDefaults.DEFAULT_DRAIN_YIELD_ITERATIONS,
        CowDefaults.DEFAULT_DRAIN_PARK_NANOS
    );

    public DrainPolicy {
        if (spinIterations < 0 || yieldIterations < 0 || parkNanos < 0) {
            throw new IllegalArgumentException("Drain policy values must be >= 0");
        }
    }

    public static DrainPolicy fromEnv() {
        return fromEnv(System.getenv());
    }

    public static DrainPolicy fromEnv(Map<String, String> env) {
        return new DrainPolicy(
            EnvVars.getIntClamped(env, CowEnvKeys.COW_DRAIN_SPIN_ITERATIONS,
                CowDefaults.DEFAULT_DRAIN_SPIN_ITERATIONS, 0, CowDefaults.MAX_DRAIN_ITERATIONS),
            EnvVars.getIntClamped(env, CowEnvKeys.COW_DRAIN_YIELD_ITERATIONS,
                CowDefaults.DEFAULT_DRAIN_YIELD_ITERATIONS, 0, CowDefaults.MAX_DRAIN_ITERATIONS),
            EnvVars.getLongClamped(env, CowEnvKeys.COW_DRAIN_PARK_NANOS,
                CowDefaults.DEFAULT_DRAIN_PARK_NANOS, 0L, CowDefaults.MAX_DRAIN_PARK_NANOS)
        );
    }

    /** Index of the first iteration that parks instead of spinning or yielding. */
    public long parkingThreshold() {
        return (long) spinIterations + yieldIterations;
    }

    public void idle(long iteration) {
        if (iteration < spinIterations) {
            Thread.onSpinWait();
        } else if (iteration < parkingThreshold()) {
            Thread.yield();
        } else if (parkNanos > 0) {
            LockSupport.parkNanos(parkNanos);
        } else {
            Thread.onSpinWait();
        }
    }
}
