package com.acme.cow.write;

/**
 * Outcome of one write call. Only {@link Applied} means a new value was published;
 * every other outcome leaves the container exactly as it was.
 */
public sealed interface WriteResult
    permits WriteResult.Applied, WriteResult.VerifierRejected, WriteResult.ConstructionFailed, WriteResult.LockBusy {

    record Applied(long drainIterations) implements WriteResult {}
    record VerifierRejected() implements WriteResult {}
    record ConstructionFailed(String reason) implements WriteResult {}
    record LockBusy() implements WriteResult {}

    default boolean isApplied() {
        return this instanceof Applied;
    }
}
