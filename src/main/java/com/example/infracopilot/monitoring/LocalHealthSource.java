package com.example.infracopilot.monitoring;

import com.example.infracopilot.domain.LocalHealthSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Local machine adapter. Always available; a failing reader degrades to a
 * zeroed snapshot with a warning instead of failing the aggregation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LocalHealthSource implements HealthSource<LocalThresholds, LocalHealthSnapshot> {

    private final LocalMetricsReader reader;

    @Override
    public LocalHealthSnapshot check(LocalThresholds thresholds) {
        LocalMetricsReader.LocalReading reading;
        try {
            reading = reader.read();
        } catch (RuntimeException e) {
            log.warn("Local metrics unavailable: {}", e.getMessage());
            return LocalHealthSnapshot.builder()
                    .warning("LOCAL: metrics unavailable - " + e.getMessage())
                    .build();
        }

        double cpu = clamp(reading.cpuPercent());
        double mem = clamp(reading.memoryPercent());
        double disk = clamp(reading.diskPercent());

        LocalHealthSnapshot.LocalHealthSnapshotBuilder snapshot = LocalHealthSnapshot.builder()
                .cpuPercent(round(cpu))
                .memoryPercent(round(mem))
                .diskPercent(round(disk))
                .uptimeSeconds(Math.max(0, reading.uptimeSeconds()));

        if (cpu > thresholds.cpuPercent()) {
            snapshot.warning(warning("CPU", cpu, thresholds.cpuPercent()));
        }
        if (mem > thresholds.memoryPercent()) {
            snapshot.warning(warning("Memory", mem, thresholds.memoryPercent()));
        }
        if (disk > thresholds.diskPercent()) {
            snapshot.warning(warning("Disk", disk, thresholds.diskPercent()));
        }
        return snapshot.build();
    }

    private static String warning(String metric, double value, double threshold) {
        return String.format(Locale.ROOT, "LOCAL: High %s %.1f%% (> %.1f%%)", metric, value, threshold);
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, value));
    }

    static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
