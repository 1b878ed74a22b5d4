package com.example.infracopilot.monitoring;

/**
 * Raw access to the local machine's resource usage.
 */
public interface LocalMetricsReader {

    LocalReading read();

    record LocalReading(double cpuPercent, double memoryPercent, double diskPercent, long uptimeSeconds) {
    }
}
