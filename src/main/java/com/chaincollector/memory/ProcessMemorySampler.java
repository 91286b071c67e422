package com.chaincollector.memory;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Samples the process resident set size against total physical memory.
 *
 * <p>Reads {@code VmRSS} from {@code /proc/self/status} and {@code MemTotal} from
 * {@code /proc/meminfo} on Linux. Elsewhere, or when procfs is unreadable, falls back to JVM
 * committed memory (heap + non-heap) over the physical total reported by the platform MXBean.
 */
public class ProcessMemorySampler implements MemorySampler {

    private static final Logger log = LoggerFactory.getLogger(ProcessMemorySampler.class);

    private final Path statusFile;
    private final Path meminfoFile;
    private volatile boolean procfsWarned;

    public ProcessMemorySampler() {
        this(Path.of("/proc/self/status"), Path.of("/proc/meminfo"));
    }

    ProcessMemorySampler(Path statusFile, Path meminfoFile) {
        this.statusFile = statusFile;
        this.meminfoFile = meminfoFile;
    }

    @Override
    public double sampleFraction() {
        OptionalLong rssKb = readKb(statusFile, "VmRSS:");
        OptionalLong totalKb = readKb(meminfoFile, "MemTotal:");
        if (rssKb.isPresent() && totalKb.isPresent() && totalKb.getAsLong() > 0) {
            return clamp((double) rssKb.getAsLong() / totalKb.getAsLong());
        }
        return jvmFraction();
    }

    private double jvmFraction() {
        long committed = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage().getCommitted()
                + ManagementFactory.getMemoryMXBean().getNonHeapMemoryUsage().getCommitted();
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        long total = 0;
        if (os instanceof com.sun.management.OperatingSystemMXBean) {
            total = ((com.sun.management.OperatingSystemMXBean) os).getTotalMemorySize();
        }
        if (total <= 0) {
            total = Runtime.getRuntime().maxMemory();
        }
        return total > 0 ? clamp((double) committed / total) : 0.0;
    }

    private OptionalLong readKb(Path file, String key) {
        if (!Files.isReadable(file)) {
            return OptionalLong.empty();
        }
        try {
            List<String> lines = Files.readAllLines(file);
            for (String line : lines) {
                if (line.startsWith(key)) {
                    String[] parts = line.substring(key.length()).trim().split("\\s+");
                    return OptionalLong.of(Long.parseLong(parts[0]));
                }
            }
        } catch (IOException | NumberFormatException e) {
            if (!procfsWarned) {
                procfsWarned = true;
                log.warn("Could not read {} from {}, falling back to JVM memory figures: {}", key, file, e.getMessage());
            }
        }
        return OptionalLong.empty();
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
