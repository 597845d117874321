package com.acme.cow.memory;

import io.netty.util.AbstractReferenceCounted;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reference-counted holder of one published value.
 *
 * <p>Starts with a count of 1 owned by its creator. The value is disposed exactly once,
 * when the count reaches zero; retaining or releasing after that raises
 * {@link io.netty.util.IllegalReferenceCountException}.</p>
 */
public final class Cell<T> extends AbstractReferenceCounted {
    private static final Logger LOG = Logger.getLogger(Cell.class.getName());

    private final T value;
    private final ValueDisposer<? super T> disposer;

    public Cell(T value, ValueDisposer<? super T> disposer) {
        this.value = Objects.requireNonNull(value, "value");
        this.disposer = Objects.requireNonNull(disposer, "disposer");
    }

    public T value() {
        return value;
    }

    @Override
    public Cell<T> retain() {
        super.retain();
        return this;
    }

    @Override
    public Cell<T> touch(Object hint) {
        return this;
    }

    @Override
    protected void deallocate() {
        try {
            disposer.dispose(value);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Value disposer failed for " + value.getClass().getName(), e);
        }
    }
}
