package com.example.infracopilot.service;

import com.example.infracopilot.domain.CloudHealthSnapshot;
import com.example.infracopilot.domain.EndpointCheckResult;
import com.example.infracopilot.domain.EndpointChecks;
import com.example.infracopilot.domain.HealthSummary;
import com.example.infracopilot.domain.LocalHealthSnapshot;
import com.example.infracopilot.domain.MetricPoint;
import com.example.infracopilot.domain.MetricsSeries;
import com.example.infracopilot.domain.ReportContext;
import com.example.infracopilot.domain.UnifiedHealthReport;
import com.example.infracopilot.monitoring.HealthAggregator;
import com.example.infracopilot.monitoring.MetricsSynthesizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.Locale;

/**
 * Assembles the structured context a narrative report is written from.
 *
 * A missing health report is filled by running a fresh aggregation and
 * missing metrics by synthesizing from the live reading. Nothing here talks
 * to the narrative service.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportCompiler {

    private final HealthAggregator healthAggregator;
    private final MetricsSynthesizer metricsSynthesizer;
    private final Clock clock;

    public ReportContext compile(UnifiedHealthReport health, MetricsSeries metrics) {
        return compile(health, metrics, ReportContext.Framing.STANDARD);
    }

    public ReportContext compile(UnifiedHealthReport health, MetricsSeries metrics, ReportContext.Framing framing) {
        if (health == null) {
            log.debug("No health report supplied, aggregating");
            health = healthAggregator.aggregate();
        }
        if (metrics == null) {
            log.debug("No metrics supplied, synthesizing from live reading");
            metrics = metricsSynthesizer.synthesizeLive();
        }

        return ReportContext.builder()
                .generatedAt(clock.instant())
                .framing(framing != null ? framing : ReportContext.Framing.STANDARD)
                .riskLevel(assessRisk(health))
                .highlights(highlights(health, metrics))
                .health(health)
                .metrics(metrics)
                .build();
    }

    /**
     * HIGH when two or more entries are degraded or the cloud credentials were
     * rejected; MEDIUM when exactly one entry is degraded or any warning was
     * raised; LOW otherwise.
     */
    static ReportContext.RiskLevel assessRisk(UnifiedHealthReport health) {
        HealthSummary summary = health.getSummary();
        int degraded = summary != null ? summary.getWarnings() : 0;
        CloudHealthSnapshot azure = health.getAzure();
        if (degraded >= 2 || (azure != null && azure.getStatus() == CloudHealthSnapshot.Status.AUTH_FAILED)) {
            return ReportContext.RiskLevel.HIGH;
        }
        if (degraded == 1 || !health.getWarnings().isEmpty()) {
            return ReportContext.RiskLevel.MEDIUM;
        }
        return ReportContext.RiskLevel.LOW;
    }

    private static List<String> highlights(UnifiedHealthReport health, MetricsSeries metrics) {
        List<String> lines = new ArrayList<>();

        HealthSummary summary = health.getSummary();
        if (summary != null) {
            lines.add(String.format("%d of %d checks healthy", summary.getHealthy(), summary.getTotal()));
        }

        LocalHealthSnapshot local = health.getLocal();
        if (local != null) {
            lines.add(String.format(Locale.ROOT, "Local CPU %.1f%%, memory %.1f%%, disk %.1f%%, up %s",
                    local.getCpuPercent(), local.getMemoryPercent(), local.getDiskPercent(),
                    formatUptime(local.getUptimeSeconds())));
        }

        CloudHealthSnapshot azure = health.getAzure();
        if (azure != null) {
            if (azure.isConfigured()) {
                long unhealthy = azure.getResources().stream().filter(r -> !r.isHealthy()).count();
                lines.add(String.format("Azure %s: %d resources, %d unhealthy",
                        azure.getStatus().getWireName(), azure.getResources().size(), unhealthy));
            } else {
                lines.add("Azure not configured");
            }
        }

        EndpointChecks custom = health.getCustom();
        if (custom != null && custom.isConfigured()) {
            long up = custom.getResults().stream().filter(EndpointCheckResult::isUp).count();
            lines.add(String.format("Endpoints %d of %d up", up, custom.getResults().size()));
        }

        if (metrics != null) {
            lines.add("CPU 24h " + range(metrics.getCpu()));
            lines.add("Memory 24h " + range(metrics.getMemory()));
        }
        return lines;
    }

    private static String range(List<MetricPoint> points) {
        if (points == null || points.isEmpty()) {
            return "n/a";
        }
        DoubleSummaryStatistics stats = points.stream().mapToDouble(MetricPoint::getValue).summaryStatistics();
        return String.format(Locale.ROOT, "min %.1f%%, avg %.1f%%, max %.1f%%",
                stats.getMin(), stats.getAverage(), stats.getMax());
    }

    private static String formatUptime(long seconds) {
        long days = seconds / 86400;
        long hours = (seconds % 86400) / 3600;
        long minutes = (seconds % 3600) / 60;
        return days > 0 ? days + "d " + hours + "h" : hours + "h " + minutes + "m";
    }
}
