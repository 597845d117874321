package com.acme.cow.memory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

public final class CellReadHandle<T> implements ReadHandle<T> {
    private final AtomicReference<Cell<T>> cell;

    /** Adopts a reference the caller already holds on {@code cell}. */
    public CellReadHandle(Cell<T> cell) {
        this.cell = new AtomicReference<>(Objects.requireNonNull(cell, "cell"));
    }

    @Override
    public T get() {
        return owned().value();
    }

    @Override
    public int refCount() {
        Cell<T> current = cell.get();
        return current == null ? 0 : current.refCnt();
    }

    @Override
    public boolean isOpen() {
        return cell.get() != null;
    }

    @Override
    public ReadHandle<T> duplicate() {
        return new CellReadHandle<>(owned().retain());
    }

    @Override
    public ReadHandle<T> move() {
        Cell<T> taken = cell.getAndSet(null);
        if (taken == null) {
            throw new IllegalStateException("Move from an empty read handle");
        }
        return new CellReadHandle<>(taken);
    }

    @Override
    public void close() {
        Cell<T> taken = cell.getAndSet(null);
        if (taken != null) {
            taken.release();
        }
    }

    private Cell<T> owned() {
        Cell<T> current = cell.get();
        if (current == null) {
            throw new IllegalStateException("Read handle is closed");
        }
        return current;
    }
}
