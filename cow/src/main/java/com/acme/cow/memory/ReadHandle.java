package com.acme.cow.memory;

/**
 * Read-only view of one published value.
 *
 * <p>Ownership: each handle holds one reference on its cell and gives it back on
 * {@link #close()}. A handle belongs to one thread at a time; use {@link #duplicate()}
 * to hand a view to another owner.</p>
 */
public interface ReadHandle<T> extends AutoCloseable {
    /**
     * The value, which must not be mutated.
     *
     * @throws IllegalStateException if the handle was closed or moved from
     */
    T get();

    int refCount();
    boolean isOpen();

    /** New handle on the same cell; the reference count goes up by one. */
    ReadHandle<T> duplicate();

    /** New handle taking over this one's reference; this handle becomes empty. */
    ReadHandle<T> move();

    /** Gives the reference back. Repeated calls are no-ops. */
    @Override
    void close();
}
