package com.example.infracopilot.monitoring;

import com.example.infracopilot.config.CopilotProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads CPU, memory, disk and uptime from the JVM's platform MXBeans.
 * Uptime comes from /proc/uptime where available, otherwise from the JVM.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SystemMetricsReader implements LocalMetricsReader {

    private static final Path PROC_UPTIME = Path.of("/proc/uptime");

    private final CopilotProperties properties;

    @Override
    public LocalReading read() {
        OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();
        return new LocalReading(
                cpuPercent(osBean),
                memoryPercent(osBean),
                diskPercent(properties.getLocal().getDiskPath()),
                uptimeSeconds());
    }

    private double cpuPercent(OperatingSystemMXBean osBean) {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
            double load = sunBean.getCpuLoad();
            if (load >= 0) {
                return load * 100.0;
            }
        }
        // getCpuLoad() is negative until the JVM has a sample; load average is the fallback
        double loadAverage = osBean.getSystemLoadAverage();
        if (loadAverage < 0) {
            return 0.0;
        }
        return Math.min(100.0, loadAverage / Math.max(1, osBean.getAvailableProcessors()) * 100.0);
    }

    private double memoryPercent(OperatingSystemMXBean osBean) {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
            long total = sunBean.getTotalMemorySize();
            long free = sunBean.getFreeMemorySize();
            if (total > 0) {
                return (total - free) * 100.0 / total;
            }
        }
        Runtime runtime = Runtime.getRuntime();
        return (runtime.totalMemory() - runtime.freeMemory()) * 100.0 / runtime.maxMemory();
    }

    private double diskPercent(String path) {
        File root = new File(path == null || path.isBlank() ? "/" : path);
        long total = root.getTotalSpace();
        if (total <= 0) {
            log.debug("Disk size unavailable for {}", root);
            return 0.0;
        }
        return (total - root.getUsableSpace()) * 100.0 / total;
    }

    private long uptimeSeconds() {
        if (Files.isReadable(PROC_UPTIME)) {
            try {
                String content = Files.readString(PROC_UPTIME).trim();
                return (long) Double.parseDouble(content.split("\\s+")[0]);
            } catch (IOException | NumberFormatException e) {
                log.debug("Could not read {}: {}", PROC_UPTIME, e.getMessage());
            }
        }
        return ManagementFactory.getRuntimeMXBean().getUptime() / 1000;
    }
}
