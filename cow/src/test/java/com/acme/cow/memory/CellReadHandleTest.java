package com.acme.cow.memory;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CellReadHandleTest {

    @Test
    void duplicateShouldRetainAndCloseShouldRelease() {
        AtomicInteger disposals = new AtomicInteger();
        ReadHandle<String> handle = new CellReadHandle<>(new Cell<>("value", v -> disposals.incrementAndGet()));
        assertEquals(1, handle.refCount());

        ReadHandle<String> copy = handle.duplicate();
        assertEquals(2, handle.refCount());
        assertEquals("value", copy.get());

        handle.close();
        assertFalse(handle.isOpen());
        assertEquals(0, handle.refCount());
        assertEquals(1, copy.refCount());
        assertEquals(0, disposals.get());

        copy.close();
        assertEquals(1, disposals.get());
    }

    @Test
    void moveShouldTransferOwnershipWithoutCountChange() {
        AtomicInteger disposals = new AtomicInteger();
        ReadHandle<String> source = new CellReadHandle<>(new Cell<>("value", v -> disposals.incrementAndGet()));
        ReadHandle<String> target = source.move();

        assertFalse(source.isOpen());
        assertTrue(target.isOpen());
        assertEquals(1, target.refCount());
        assertThrows(IllegalStateException.class, source::get);
        assertThrows(IllegalStateException.class, source::move);
        assertThrows(IllegalStateException.class, source::duplicate);

        source.close();
        assertEquals(0, disposals.get());
        target.close();
        assertEquals(1, disposals.get());
    }

    @Test
    void repeatedCloseShouldReleaseOnlyOnce() {
        Cell<String> cell = new Cell<>("value", ValueDisposer.none());
        cell.retain();
        ReadHandle<String> handle = new CellReadHandle<>(cell);
        handle.close();
        handle.close();
        assertEquals(1, cell.refCnt());
        cell.release();
    }
}
