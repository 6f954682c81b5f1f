package cli;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;

/**
 * Progress logger for multi-file runs.
 */
public final class CliProgressMonitor {

    private CliProgressMonitor() {
    }

    public static void logProgress(int done, int total, int success, int skip, int failed,
                                   long loopStartNs, String lastFile) {
        long elapsed = (System.nanoTime() - loopStartNs) / 1_000_000L;

        MemoryMXBean mem = ManagementFactory.getMemoryMXBean();
        MemoryUsage heap = mem.getHeapMemoryUsage();
        long usedMb = heap.getUsed() / (1024 * 1024);
        long maxMb = heap.getMax() / (1024 * 1024);

        System.out.printf("[PROGRESS] %d/%d success=%d skip=%d failed=%d elapsed=%dms heap=%d/%dMB last=%s%n",
                done, total, success, skip, failed, elapsed, usedMb, maxMb, lastFile);
    }
}
