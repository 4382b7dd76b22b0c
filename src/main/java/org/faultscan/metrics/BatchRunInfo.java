package org.faultscan.metrics;

import java.time.Duration;

public record BatchRunInfo(Status status, int processed, int failed, int numThreads, Duration wallTime) {

    public double wallTimeSeconds() {
        return wallTime.toNanos() / 1_000_000_000.0;
    }
}
