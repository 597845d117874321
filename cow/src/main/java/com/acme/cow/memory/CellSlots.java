package com.acme.cow.memory;

import com.acme.cow.word.ControlWord;

import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Two-entry table resolving a control-word token to its cell.
 *
 * <p>The published cell sits in the slot chosen by its token's low bit; a writer
 * stages its candidate in the other one. Only the write-lock holder stores or
 * takes; readers look up a token only while they are counted in flight.</p>
 */
final class CellSlots<T> {
    private final AtomicReferenceArray<Cell<T>> slots = new AtomicReferenceArray<>(2);

    Cell<T> get(long token) {
        Cell<T> cell = slots.get(ControlWord.slotOf(token));
        if (cell == null) {
            throw new IllegalStateException("No cell staged for token=" + token);
        }
        return cell;
    }

    void put(long token, Cell<T> cell) {
        int slot = ControlWord.slotOf(token);
        if (slots.get(slot) != null) {
            throw new IllegalStateException("Slot " + slot + " still holds a cell, token=" + token);
        }
        slots.set(slot, cell);
    }

    Cell<T> take(long token) {
        Cell<T> cell = slots.getAndSet(ControlWord.slotOf(token), null);
        if (cell == null) {
            throw new IllegalStateException("No cell staged for token=" + token);
        }
        return cell;
    }
}
