package com.example.infracopilot.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * A synthetic 24-hour trend for CPU and memory. Each series holds one point
 * per trailing hour, oldest first, ending at {@code timestamp}.
 */
@Value
@Builder
@Jacksonized
public class MetricsSeries {

    Instant timestamp;

    @Builder.Default
    String range = "24h";

    @Builder.Default
    boolean syntheticTrend = true;

    List<MetricPoint> cpu;
    List<MetricPoint> memory;
}
