package com.acme.cow;

import com.acme.cow.memory.ReadHandle;
import com.acme.cow.write.WriteResult;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CopyOnWriteConcurrencyTest {

    @Test
    void boundedEditCounterShouldStayInRangeForConcurrentReaders() throws Exception {
        int minValue = 0;
        int maxValue = 10_000;
        int readers = 4;
        CopyOnWrite<TestValue> tested = new CopyOnWrite<>(new TestValue(minValue), TestValue::copyOf);
        ExecutorService pool = Executors.newFixedThreadPool(readers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean done = new AtomicBoolean();
        try {
            Future<?>[] futures = new Future<?>[readers];
            for (int i = 0; i < readers; i++) {
                futures[i] = pool.submit(() -> {
                    start.await();
                    while (!done.get()) {
                        int copy = TestValue.readA(tested);
                        if (copy < minValue || copy > maxValue) {
                            throw new IllegalStateException("Out of range value read: " + copy);
                        }
                    }
                    return null;
                });
            }

            start.countDown();
            int applied = 0;
            while (tested.edit(edited -> edited.a++, before -> before.a < maxValue)) {
                applied++;
            }
            done.set(true);
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }

            assertEquals(maxValue, applied);
            assertEquals(maxValue, TestValue.readA(tested));
        } finally {
            tested.close();
            pool.shutdownNow();
            pool.awaitTermination(2, TimeUnit.SECONDS);
        }
    }

    @Test
    void resetCounterShouldTrackExternallyPublishedValue() throws Exception {
        int minValue = 0;
        int maxValue = 10_000;
        int readers = 4;
        CopyOnWrite<TestValue> tested = new CopyOnWrite<>(new TestValue(minValue), TestValue::copyOf);
        AtomicInteger officialValue = new AtomicInteger(minValue);
        ExecutorService pool = Executors.newFixedThreadPool(readers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean done = new AtomicBoolean();
        try {
            Future<?>[] futures = new Future<?>[readers];
            for (int i = 0; i < readers; i++) {
                futures[i] = pool.submit(() -> {
                    start.await();
                    while (!done.get()) {
                        int starting = officialValue.get() - 1;
                        int copy = TestValue.readA(tested);
                        int ending = officialValue.get();
                        if (copy < starting || copy > ending) {
                            throw new IllegalStateException(
                                "Read " + copy + " outside [" + starting + ", " + ending + "]");
                        }
                    }
                    return null;
                });
            }

            start.countDown();
            while (TestValue.readA(tested) < maxValue) {
                int previous = TestValue.readA(tested);
                assertTrue(tested.reset(made -> officialValue.set(made.a), v -> true, () -> new TestValue(previous + 1)));
            }
            done.set(true);
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }

            assertEquals(maxValue, TestValue.readA(tested));
            assertEquals(maxValue, officialValue.get());
        } finally {
            tested.close();
            pool.shutdownNow();
            pool.awaitTermination(2, TimeUnit.SECONDS);
        }
    }

    @Test
    void readersShouldNeverObserveAMixOfOldAndNewFields() throws Exception {
        int readers = 4;
        int writes = 20_000;
        CopyOnWrite<TestValue> tested = new CopyOnWrite<>(new TestValue(0), TestValue::copyOf);
        ExecutorService pool = Executors.newFixedThreadPool(readers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean done = new AtomicBoolean();
        try {
            Future<?>[] futures = new Future<?>[readers];
            for (int i = 0; i < readers; i++) {
                futures[i] = pool.submit(() -> {
                    start.await();
                    while (!done.get()) {
                        try (ReadHandle<TestValue> handle = tested.read()) {
                            TestValue seen = handle.get();
                            int a = seen.a;
                            int b = seen.b;
                            if (a != b) {
                                throw new IllegalStateException("Torn read a=" + a + " b=" + b);
                            }
                        }
                    }
                    return null;
                });
            }

            start.countDown();
            for (int i = 1; i <= writes; i++) {
                int next = i;
                assertTrue(tested.edit(edited -> {
                    edited.a = next;
                    Thread.onSpinWait();
                    edited.b = next;
                }));
            }
            done.set(true);
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
            assertEquals(writes, TestValue.readB(tested));
        } finally {
            tested.close();
            pool.shutdownNow();
            pool.awaitTermination(2, TimeUnit.SECONDS);
        }
    }

    @Test
    void tryVariantsShouldFailFastWhileAnotherWriteIsInProgress() throws Exception {
        CopyOnWrite<TestValue> tested = new CopyOnWrite<>(new TestValue(1), TestValue::copyOf,
            CopyOnWriteOptions.<TestValue>defaults().withDefaultFactory(() -> new TestValue(0)));
        ExecutorService pool = Executors.newSingleThreadExecutor();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        AtomicBoolean callbackRan = new AtomicBoolean();
        try {
            Future<Boolean> slowWrite = pool.submit(() -> tested.edit(edited -> {
                entered.countDown();
                try {
                    proceed.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
                edited.a = 2;
            }));
            assertTrue(entered.await(10, TimeUnit.SECONDS));

            WriteResult busy = tested.tryEditOutcome(v -> callbackRan.set(true), v -> {
                callbackRan.set(true);
                return true;
            });
            assertInstanceOf(WriteResult.LockBusy.class, busy);
            assertFalse(tested.tryReset(v -> callbackRan.set(true), v -> {
                callbackRan.set(true);
                return true;
            }));
            assertFalse(tested.tryReset(v -> callbackRan.set(true)));
            assertFalse(callbackRan.get());
            assertEquals(1, TestValue.readA(tested), "Reads proceed while the writer holds the lock");

            proceed.countDown();
            assertTrue(slowWrite.get(10, TimeUnit.SECONDS));
            assertEquals(2, TestValue.readA(tested));
            assertTrue(tested.tryEdit(v -> v.a = 3));
        } finally {
            proceed.countDown();
            tested.close();
            pool.shutdownNow();
            pool.awaitTermination(2, TimeUnit.SECONDS);
        }
    }

    @Test
    void concurrentWritersShouldBeSerialized() throws Exception {
        int writers = 4;
        int perWriter = 2_500;
        CopyOnWrite<TestValue> tested = new CopyOnWrite<>(new TestValue(0), TestValue::copyOf);
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?>[] futures = new Future<?>[writers];
            for (int i = 0; i < writers; i++) {
                futures[i] = pool.submit(() -> {
                    start.await();
                    for (int j = 0; j < perWriter; j++) {
                        tested.edit(edited -> edited.a++);
                    }
                    return null;
                });
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
            assertEquals(writers * perWriter, TestValue.readA(tested));
        } finally {
            tested.close();
            pool.shutdownNow();
            pool.awaitTermination(2, TimeUnit.SECONDS);
        }
    }
}
