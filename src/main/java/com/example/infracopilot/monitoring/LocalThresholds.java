package com.example.infracopilot.monitoring;

import com.example.infracopilot.config.CopilotProperties;

/**
 * Warn levels in percent. A reading warns only when strictly above its threshold.
 */
public record LocalThresholds(double cpuPercent, double memoryPercent, double diskPercent) {

    public static LocalThresholds from(CopilotProperties.LocalConfig config) {
        return new LocalThresholds(config.getCpuWarnPercent(), config.getMemoryWarnPercent(),
                config.getDiskWarnPercent());
    }
}
