package com.example.infracopilot.monitoring;

import com.example.infracopilot.domain.MetricPoint;
import com.example.infracopilot.domain.MetricsSeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;

/**
 * Derives a plausible 24-hour trend from a single live reading.
 *
 * The series is walked backwards from the base value: each earlier hour moves
 * a seeded random step away from its successor while being pulled back toward
 * the base. The random source is seeded from the inputs, so the same base and
 * {@code now} always give the same series.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricsSynthesizer {

    static final int POINTS = 24;
    private static final double REVERSION = 0.25;
    private static final double CPU_STEP = 6.0;
    private static final double MEMORY_STEP = 2.5;

    private final LocalMetricsReader reader;
    private final Clock clock;

    public MetricsSeries synthesize(double baseCpu, double baseMemory, Instant now) {
        return MetricsSeries.builder()
                .timestamp(now)
                .cpu(series("cpu", baseCpu, CPU_STEP, now))
                .memory(series("memory", baseMemory, MEMORY_STEP, now))
                .build();
    }

    /** Uses the current CPU and memory reading as the base. */
    public MetricsSeries synthesizeLive() {
        Instant now = clock.instant();
        double cpu = 0;
        double memory = 0;
        try {
            LocalMetricsReader.LocalReading reading = reader.read();
            cpu = reading.cpuPercent();
            memory = reading.memoryPercent();
        } catch (RuntimeException e) {
            log.warn("Live metrics unavailable, synthesizing from zero: {}", e.getMessage());
        }
        return synthesize(cpu, memory, now);
    }

    private static List<MetricPoint> series(String name, double base, double step, Instant now) {
        double anchor = LocalHealthSource.clamp(base);
        SplittableRandom random = new SplittableRandom(seed(name, anchor, now));

        double[] values = new double[POINTS];
        values[POINTS - 1] = anchor;
        for (int i = POINTS - 2; i >= 0; i--) {
            double next = values[i + 1];
            double drift = REVERSION * (anchor - next);
            values[i] = LocalHealthSource.clamp(next + drift + random.nextDouble(-step, step));
        }

        List<MetricPoint> points = new ArrayList<>(POINTS);
        for (int i = 0; i < POINTS; i++) {
            Instant t = now.minus(Duration.ofHours(POINTS - 1L - i));
            points.add(new MetricPoint(t, LocalHealthSource.round(values[i])));
        }
        return points;
    }

    private static long seed(String name, double base, Instant now) {
        long h = Double.doubleToLongBits(base);
        h = 31 * h + now.getEpochSecond();
        h = 31 * h + now.getNano();
        h = 31 * h + name.hashCode();
        return h;
    }
}
