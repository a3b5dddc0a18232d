package com.myorg.justelparser.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.lang.management.ManagementFactory;
import com.sun.management.OperatingSystemMXBean;

/**
 * Step timer writing to the dedicated "performance" logger.
 */
public class PerfProbe {
    private static final Logger PERF = LoggerFactory.getLogger("performance");
    private static final OperatingSystemMXBean OS =
            (OperatingSystemMXBean) ManagementFactory.getOperatingSystemMXBean();

    private final long t0 = System.nanoTime();
    private long last = t0;
    private final String label;

    public PerfProbe(String label) { this.label = label; }

    /**
     * Logs the time since the previous mark and the throughput in units per second
     * (documents or articles, depending on the step).
     */
    public void mark(String stepName, long unitsProcessed) {
        long now = System.nanoTime();
        double ms = (now - last) / 1_000_000.0;
        double sec = ms / 1000.0;
        last = now;

        double perSec = (sec > 0) ? (unitsProcessed / sec) : 0.0;
        double cpuPct = OS.getProcessCpuLoad();
        if (cpuPct >= 0) cpuPct *= 100.0; else cpuPct = 0.0;

        Runtime rt = Runtime.getRuntime();
        double usedMB = (rt.totalMemory() - rt.freeMemory()) / (1024.0 * 1024.0);

        PERF.info("{} - {}: {} units in {} ms ({}/s), CPU: {}%, Memory: {} MB",
                label,
                stepName,
                unitsProcessed,
                String.format("%.2f", ms),
                String.format("%.2f", perSec),
                String.format("%.1f", cpuPct),
                String.format("%.2f", usedMB)
        );
    }

    public long done(String stepName) {
        long totalMs = (System.nanoTime() - t0) / 1_000_000;
        PERF.info("{} - {} total {} ms", label, stepName, totalMs);
        return totalMs;
    }
}
