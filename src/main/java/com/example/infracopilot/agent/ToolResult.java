package com.example.infracopilot.agent;

import com.example.infracopilot.domain.MetricsSeries;
import com.example.infracopilot.domain.ReportContext;
import com.example.infracopilot.domain.UnifiedHealthReport;
import lombok.Builder;
import lombok.Value;

/**
 * Result of one tool execution. Successful results carry the typed payload
 * the tool produced; failed ones carry only {@code error}.
 */
@Value
@Builder
public class ToolResult {

    @Builder.Default
    boolean success = true;

    String error;
    UnifiedHealthReport health;
    MetricsSeries metrics;
    ReportContext report;
    String reportMarkdown;

    public static ToolResult health(UnifiedHealthReport health) {
        return ToolResult.builder().health(health).build();
    }

    public static ToolResult metrics(MetricsSeries metrics) {
        return ToolResult.builder().metrics(metrics).build();
    }

    /** The report also exposes the health and metrics it was compiled from. */
    public static ToolResult report(ReportContext report, String markdown) {
        return ToolResult.builder()
                .report(report)
                .reportMarkdown(markdown)
                .health(report.getHealth())
                .metrics(report.getMetrics())
                .build();
    }

    public static ToolResult error(String errorMessage) {
        return ToolResult.builder()
                .success(false)
                .error(errorMessage)
                .build();
    }
}
