package com.acme.cow.memory;

import com.acme.cow.word.ControlWord;
import com.acme.cow.word.DrainCounter;
import com.acme.cow.word.DrainPolicy;

import java.util.Objects;

/**
 * Publishes one cell at a time to lock-free readers.
 *
 * <h3>Reader protocol ({@link #acquire()})</h3>
 * <ol>
 *   <li>Count itself in flight on the control word, capturing the token it saw.</li>
 *   <li>Retain that token's cell. From here on the reader owns a reference.</li>
 *   <li>Uncount itself if the token is unchanged; otherwise decrement the drain
 *       counter, because the writer that replaced the token took over its credit.</li>
 * </ol>
 *
 * <h3>Writer protocol ({@link #publish(Cell)}, {@link #retire()})</h3>
 * <p>Callers must hold the container's write lock. The writer stages the new cell,
 * exchanges the token, credits the captured in-flight count to the drain counter,
 * waits for it to reach zero and only then drops its reference to the prior cell.</p>
 */
public final class Publication<T> {
    private final ControlWord controlWord;
    private final DrainCounter drainCounter = new DrainCounter();
    private final CellSlots<T> slots = new CellSlots<>();
    private final DrainPolicy drainPolicy;

    // guarded by the write lock
    private long currentToken;

    private volatile Runnable afterReaderEntered = () -> { };

    public Publication(Cell<T> initial, DrainPolicy drainPolicy) {
        Objects.requireNonNull(initial, "initial");
        this.drainPolicy = Objects.requireNonNull(drainPolicy, "drainPolicy");
        this.currentToken = ControlWord.FIRST_TOKEN;
        this.slots.put(currentToken, initial);
        this.controlWord = new ControlWord(currentToken);
    }

    /**
     * Returns the published cell, retained on behalf of the caller.
     *
     * @throws IllegalStateException if the publication has been retired
     */
    public Cell<T> acquire() {
        long observed = controlWord.enterReader();
        try {
            afterReaderEntered.run();
            return slots.get(ControlWord.token(observed)).retain();
        } finally {
            if (!controlWord.leaveReader(observed)) {
                drainCounter.readerLeftStale();
            }
        }
    }

    /** Published cell, not retained. Write-lock holder only. */
    public Cell<T> current() {
        ensureLive();
        return slots.get(currentToken);
    }

    /**
     * Replaces the published cell and releases the publication's reference to the prior one.
     * Write-lock holder only.
     *
     * @return idle iterations spent draining stale readers
     */
    public long publish(Cell<T> replacement) {
        Objects.requireNonNull(replacement, "replacement");
        ensureLive();
        long token = ControlWord.nextToken(currentToken);
        slots.put(token, replacement);
        return swapAndDrain(token);
    }

    /**
     * Publishes no cell at all. Readers arriving afterwards fail; the last cell lives on
     * through any outstanding reader references. Write-lock holder only.
     *
     * @return idle iterations spent draining stale readers
     */
    public long retire() {
        ensureLive();
        return swapAndDrain(ControlWord.CLOSED_TOKEN);
    }

    public boolean isRetired() {
        return currentToken == ControlWord.CLOSED_TOKEN;
    }

    /** Diagnostic view of the drain counter; zero whenever no write is in progress. */
    public int pendingDrain() {
        return drainCounter.get();
    }

    public long controlWord() {
        return controlWord.load();
    }

    /** Runs on the reader thread after it is counted in flight and before it retains. */
    void afterReaderEntered(Runnable hook) {
        this.afterReaderEntered = Objects.requireNonNull(hook, "hook");
    }

    private long swapAndDrain(long token) {
        long prior = controlWord.exchange(token);
        drainCounter.credit(ControlWord.inFlight(prior));
        long iterations = drainCounter.awaitZero(drainPolicy);
        Cell<T> previous = slots.take(currentToken);
        currentToken = token;
        previous.release();
        return iterations;
    }

    private void ensureLive() {
        if (isRetired()) {
            throw new IllegalStateException("Publication is retired");
        }
    }
}
