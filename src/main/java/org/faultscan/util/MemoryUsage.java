package org.faultscan.util;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryPoolMXBean;

/**
 * Peak memory reported by the JVM's memory pools.
 */
public final class MemoryUsage {

    private static final long BYTES_PER_MB = 1024L * 1024L;

    private MemoryUsage() {
    }

    public static long peakMemoryMb() {
        long peakBytes = 0;
        for (MemoryPoolMXBean pool : ManagementFactory.getMemoryPoolMXBeans()) {
            java.lang.management.MemoryUsage peak = pool.getPeakUsage();
            if (peak != null) peakBytes += peak.getUsed();
        }
        return peakBytes / BYTES_PER_MB;
    }
}
