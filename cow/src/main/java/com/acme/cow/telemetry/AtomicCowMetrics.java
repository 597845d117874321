package com.acme.cow.telemetry;

import com.acme.cow.write.WriteResult;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

public final class AtomicCowMetrics implements CowMetrics {
    private final LongAdder reads = new LongAdder();
    private final LongAdder applied = new LongAdder();
    private final LongAdder verifierRejected = new LongAdder();
    private final LongAdder constructionFailed = new LongAdder();
    private final LongAdder lockBusy = new LongAdder();
    private final LongAdder writeErrors = new LongAdder();
    private final LongAdder drainIterations = new LongAdder();
    private final LongAdder drainSamples = new LongAdder();
    private final AtomicLong maxDrainIterations = new AtomicLong();
    private final LongAdder cellsDisposed = new LongAdder();

    @Override
    public void incReads(long n) {
        reads.add(Math.max(0L, n));
    }

    @Override
    public void onWrite(WriteResult result) {
        if (result instanceof WriteResult.Applied) {
            applied.increment();
        } else if (result instanceof WriteResult.VerifierRejected) {
            verifierRejected.increment();
        } else if (result instanceof WriteResult.ConstructionFailed) {
            constructionFailed.increment();
        } else if (result instanceof WriteResult.LockBusy) {
            lockBusy.increment();
        }
    }

    @Override
    public void incWriteErrors(long n) {
        writeErrors.add(Math.max(0L, n));
    }

    @Override
    public void observeDrainIterations(long iterations) {
        if (iterations < 0) return;
        drainIterations.add(iterations);
        drainSamples.increment();
        maxDrainIterations.accumulateAndGet(iterations, Math::max);
    }

    @Override
    public void incCellsDisposed(long n) {
        cellsDisposed.add(Math.max(0L, n));
    }

    public Snapshot snapshot() {
        return new Snapshot(
            reads.sum(),
            applied.sum(),
            verifierRejected.sum(),
            constructionFailed.sum(),
            lockBusy.sum(),
            writeErrors.sum(),
            drainIterations.sum(),
            drainSamples.sum(),
            maxDrainIterations.get(),
            cellsDisposed.sum()
        );
    }

    public record Snapshot(long reads,
                           long writesApplied,
                           long verifierRejected,
                           long constructionFailed,
                           long lockBusy,
                           long writeErrors,
                           long drainIterationsTotal,
                           long drainSamples,
                           long drainIterationsMax,
                           long cellsDisposed) {}
}
