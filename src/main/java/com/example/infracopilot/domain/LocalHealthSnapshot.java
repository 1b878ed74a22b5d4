package com.example.infracopilot.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Point-in-time reading of the machine this service runs on.
 * Percentages are clamped to [0, 100].
 */
@Value
@Builder
@Jacksonized
public class LocalHealthSnapshot {

    @JsonProperty("cpu_percent")
    double cpuPercent;

    @JsonProperty("memory_percent")
    double memoryPercent;

    @JsonProperty("disk_percent")
    double diskPercent;

    @JsonProperty("uptime_seconds")
    long uptimeSeconds;

    @Singular
    List<String> warnings;

    @JsonIgnore
    public boolean isHealthy() {
        return warnings.isEmpty();
    }
}
