package com.acme.cow.word;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Signed counter of readers that observed a superseded token but have not yet
 * finished registering interest in its cell.
 *
 * <p>Late readers decrement it; the writer adds the in-flight count captured by
 * its exchange and then waits for zero. Readers may get there first, so the value
 * is transiently negative.</p>
 */
public final class DrainCounter {
    private static final Logger LOG = Logger.getLogger(DrainCounter.class.getName());

    private final AtomicInteger pending = new AtomicInteger();

    public void readerLeftStale() {
        pending.decrementAndGet();
    }

    public void credit(int inFlight) {
        if (inFlight != 0) {
            pending.addAndGet(inFlight);
        }
    }

    public int get() {
        return pending.get();
    }

    /**
     * Waits until every stale reader has checked out.
     *
     * @return number of idle iterations spent waiting
     */
    public long awaitZero(DrainPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        long iterations = 0;
        while (pending.get() != 0) {
            if (iterations == policy.parkingThreshold() && policy.parkNanos() > 0 && LOG.isLoggable(Level.FINE)) {
                LOG.fine("Drain wait escalated to parking, pending=" + pending.get());
            }
            policy.idle(iterations++);
        }
        return iterations;
    }
}
