package com.acme.cow.telemetry;

import com.acme.cow.write.WriteResult;

public interface CowMetrics {
    void incReads(long n);
    void onWrite(WriteResult result);
    void incWriteErrors(long n);
    void observeDrainIterations(long iterations);
    void incCellsDisposed(long n);
}
