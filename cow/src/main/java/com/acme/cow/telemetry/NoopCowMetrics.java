package com.acme.cow.telemetry;

import com.acme.cow.write.WriteResult;

public final class NoopCowMetrics implements CowMetrics {
    public static final NoopCowMetrics INSTANCE = new NoopCowMetrics();

    private NoopCowMetrics() {
    }

    @Override
    public void incReads(long n) {
    }

    @Override
    public void onWrite(WriteResult result) {
    }

    @Override
    public void incWriteErrors(long n) {
    }

    @Override
    public void observeDrainIterations(long iterations) {
    }

    @Override
    public void incCellsDisposed(long n) {
    }
}
