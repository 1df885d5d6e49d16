package org.dxworks.codefix.model;

import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-run counters, updated concurrently by the file workers.
 */
public class RunSummary {

    private final AtomicInteger filesScanned = new AtomicInteger();
    private final AtomicInteger filesChanged = new AtomicInteger();
    private final AtomicInteger totalRewrites = new AtomicInteger();
    private final AtomicInteger diagnostics = new AtomicInteger();
    private final Map<String, String> failures = Collections.synchronizedMap(new TreeMap<>());

    public void recordScanned() {
        filesScanned.incrementAndGet();
    }

    public void recordChanged(int rewrites) {
        filesChanged.incrementAndGet();
        totalRewrites.addAndGet(rewrites);
    }

    public void recordDiagnostics(int count) {
        diagnostics.addAndGet(count);
    }

    public void recordFailure(String file, String reason) {
        failures.put(file, reason);
    }

    public int getFilesScanned() {
        return filesScanned.get();
    }

    public int getFilesChanged() {
        return filesChanged.get();
    }

    public int getTotalRewrites() {
        return totalRewrites.get();
    }

    public int getDiagnostics() {
        return diagnostics.get();
    }

    public int getFilesWithErrors() {
        return failures.size();
    }

    public Map<String, String> getFailures() {
        synchronized (failures) {
            return new TreeMap<>(failures);
        }
    }
}
