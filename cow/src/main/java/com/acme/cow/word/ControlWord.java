package com.acme.cow.word;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Single atomic word naming the published cell and counting readers in flight.
 *
 * <p>Layout: bits 0..47 carry the cell token, bits 48..63 the number of readers
 * currently between "observed this token" and "registered interest in its cell".
 * Writers replace the token; readers only move the counter field.</p>
 *
 * <p>Token {@link #CLOSED_TOKEN} names no cell. Consecutive tokens produced by
 * {@link #nextToken(long)} always alternate their low bit, which selects one of
 * two cell slots.</p>
 */
public final class ControlWord {
    public static final int TOKEN_BITS = 48;
    public static final long TOKEN_MASK = (1L << TOKEN_BITS) - 1;
    public static final long IN_FLIGHT_ONE = 1L << TOKEN_BITS;
    public static final int MAX_IN_FLIGHT = (1 << (Long.SIZE - TOKEN_BITS)) - 1;

    public static final long CLOSED_TOKEN = 0L;
    public static final long FIRST_TOKEN = 1L;

    private final AtomicLong word;

    public ControlWord(long token) {
        this.word = new AtomicLong(pack(token, 0));
    }

    public long load() {
        return word.get();
    }

    /**
     * Registers one in-flight reader and returns the word it observed before
     * the increment.
     *
     * @throws IllegalStateException if the word names no cell
     */
    public long enterReader() {
        long observed = word.get();
        while (true) {
            if (token(observed) == CLOSED_TOKEN) {
                throw new IllegalStateException("Container is closed");
            }
            long next = withInFlightIncremented(observed);
            long witness = word.compareAndExchange(observed, next);
            if (witness == observed) {
                return observed;
            }
            observed = witness;
        }
    }

    /**
     * Undoes {@link #enterReader()} when the token is still the one observed.
     *
     * @return {@code false} if a writer replaced the token in the meantime; the
     *         reader's in-flight credit then belongs to that writer's drain
     */
    public boolean leaveReader(long observed) {
        long current = word.get();
        while (true) {
            if (!sameToken(current, observed)) {
                return false;
            }
            long next = withInFlightDecremented(current);
            long witness = word.compareAndExchange(current, next);
            if (witness == current) {
                return true;
            }
            current = witness;
        }
    }

    /**
     * Publishes {@code token} with a zeroed counter.
     *
     * @return the prior word, including the readers caught in flight
     */
    public long exchange(long token) {
        return word.getAndSet(pack(token, 0));
    }

    public static long pack(long token, int inFlight) {
        if ((token & ~TOKEN_MASK) != 0) {
            throw new IllegalArgumentException("Token out of range: " + token);
        }
        if (inFlight < 0 || inFlight > MAX_IN_FLIGHT) {
            throw new IllegalArgumentException("In-flight count out of range: " + inFlight);
        }
        return ((long) inFlight << TOKEN_BITS) | token;
    }

    public static long token(long word) {
        return word & TOKEN_MASK;
    }

    public static int inFlight(long word) {
        return (int) (word >>> TOKEN_BITS);
    }

    public static boolean sameToken(long a, long b) {
        return token(a) == token(b);
    }

    public static long withInFlightIncremented(long word) {
        if (inFlight(word) == MAX_IN_FLIGHT) {
            throw new IllegalStateException("In-flight reader count overflow, max=" + MAX_IN_FLIGHT);
        }
        return word + IN_FLIGHT_ONE;
    }

    public static long withInFlightDecremented(long word) {
        if (inFlight(word) == 0) {
            throw new IllegalStateException("In-flight reader count underflow, token=" + token(word));
        }
        return word - IN_FLIGHT_ONE;
    }

    public static long nextToken(long token) {
        long next = (token + 1) & TOKEN_MASK;
        // 0 is reserved; 2 keeps the slot bit alternating after the wrap from an odd token
        return next == CLOSED_TOKEN ? 2L : next;
    }

    public static int slotOf(long token) {
        return (int) (token & 1L);
    }
}
