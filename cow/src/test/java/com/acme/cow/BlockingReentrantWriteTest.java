package com.acme.cow;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * A blocking write issued from inside a write on the same container never returns.
 *
 * <p>The writer thread stays parked on the write lock until the JVM exits and its
 * container is never closed; the thread is a daemon so the test run still ends. Kept
 * apart from the other container tests so the SEVERE log and the stuck thread do not
 * interleave with them.</p>
 */
class BlockingReentrantWriteTest {

    @Test
    void blockingWriteFromInsideAWriteShouldNeverReturn() throws Exception {
        CopyOnWrite<TestValue> tested = new CopyOnWrite<>(new TestValue(1), TestValue::copyOf);
        AtomicBoolean nestedReturned = new AtomicBoolean();
        Thread writer = new Thread(() -> tested.edit(v -> {
            tested.edit(inner -> inner.a = 3);
            nestedReturned.set(true);
        }), "reentrant-writer");
        writer.setDaemon(true);
        writer.start();
        writer.join(300);

        assertTrue(writer.isAlive());
        assertFalse(nestedReturned.get());
        assertFalse(tested.tryEdit(v -> v.a = 4));
        assertEquals(1, TestValue.readA(tested), "Readers are not blocked by the stuck writer");
    }
}
