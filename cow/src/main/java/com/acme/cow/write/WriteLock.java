package com.acme.cow.write;

import java.util.concurrent.Semaphore;
import java.util.logging.Logger;

/**
 * Non-reentrant mutual exclusion for the writers of one container.
 *
 * <p>A thread that already holds the lock and calls {@link #lock()} again blocks forever.
 * {@link #tryLock()} from the holder returns {@code false}, which is what makes
 * the try-variants safe to call from inside a modifier or verifier.</p>
 */
public final class WriteLock {
    private static final Logger LOG = Logger.getLogger(WriteLock.class.getName());

    private final Semaphore permit = new Semaphore(1);
    private volatile Thread owner;

    /** Blocks uninterruptibly until the lock is free. */
    public void lock() {
        Thread current = Thread.currentThread();
        if (owner == current) {
            LOG.severe("Blocking write re-entered on thread '" + current.getName()
                + "' while it holds the write lock; this call never returns. Use tryEdit/tryReset for nested writes.");
        }
        permit.acquireUninterruptibly();
        owner = current;
    }

    public boolean tryLock() {
        if (!permit.tryAcquire()) {
            return false;
        }
        owner = Thread.currentThread();
        return true;
    }

    public void unlock() {
        if (owner != Thread.currentThread()) {
            throw new IllegalMonitorStateException("Write lock is not held by " + Thread.currentThread().getName());
        }
        owner = null;
        permit.release();
    }

    public boolean isHeldByCurrentThread() {
        return owner == Thread.currentThread();
    }

    public boolean isLocked() {
        return permit.availablePermits() == 0;
    }
}
