package com.example.infracopilot.tools;

import com.example.infracopilot.agent.AgentTool;
import com.example.infracopilot.agent.NarrativeService;
import com.example.infracopilot.agent.ToolContext;
import com.example.infracopilot.agent.ToolResult;
import com.example.infracopilot.domain.MetricsSeries;
import com.example.infracopilot.domain.ReportContext;
import com.example.infracopilot.domain.UnifiedHealthReport;
import com.example.infracopilot.monitoring.HealthAggregator;
import com.example.infracopilot.monitoring.MetricsSynthesizer;
import com.example.infracopilot.service.ReportCompiler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Report Tool - Compiles health and metrics into a report context and has the
 * narrative service write it up. Reuses the health and metrics of the same
 * turn when the other tools produced them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReportTool implements AgentTool {

    private final HealthAggregator healthAggregator;
    private final MetricsSynthesizer metricsSynthesizer;
    private final ReportCompiler reportCompiler;
    private final NarrativeService narrativeService;

    @Override
    public String getName() { return "run_report"; }

    @Override
    public String getDescription() {
        return "Produce a Markdown infra health report with a risk level and next actions, " +
               "built from a fresh health check and the 24h metrics. " +
               "Use for report, summary or daily report requests.";
    }

    @Override
    public Map<String, Object> getParameterSchema() {
        return Map.of("type", "object", "properties", Map.of());
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        ReportContext report;
        try {
            UnifiedHealthReport health = context.shared(ToolContext.HEALTH, healthAggregator::aggregate);
            MetricsSeries metrics = context.shared(ToolContext.METRICS, metricsSynthesizer::synthesizeLive);
            report = reportCompiler.compile(health, metrics, context.getFraming());
        } catch (RuntimeException e) {
            log.error("Report compilation failed: {}", e.getMessage(), e);
            return ToolResult.error("Report unavailable: " + e.getMessage());
        }
        log.info("Writing {} report (risk={})", report.getFraming(), report.getRiskLevel());
        String markdown = narrativeService.writeReport(report);
        return ToolResult.report(report, markdown);
    }
}
