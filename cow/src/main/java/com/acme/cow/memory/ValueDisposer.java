package com.acme.cow.memory;

import io.netty.util.ReferenceCountUtil;

/**
 * Releases whatever a value holds once its cell is deallocated.
 * Invoked exactly once per value, on whichever thread drops the last reference.
 */
@FunctionalInterface
public interface ValueDisposer<T> {
    void dispose(T value);

    /** Releases values that are Netty {@link io.netty.util.ReferenceCounted}; ignores anything else. */
    static <T> ValueDisposer<T> releasingReferenceCounted() {
        return ReferenceCountUtil::release;
    }

    static <T> ValueDisposer<T> none() {
        return value -> {
        };
    }
}
