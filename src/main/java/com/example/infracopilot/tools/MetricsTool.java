package com.example.infracopilot.tools;

import com.example.infracopilot.agent.AgentTool;
import com.example.infracopilot.agent.ToolContext;
import com.example.infracopilot.agent.ToolResult;
import com.example.infracopilot.domain.MetricsSeries;
import com.example.infracopilot.monitoring.MetricsSynthesizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Metrics Tool - 24-hour CPU and memory trend anchored on the live reading.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricsTool implements AgentTool {

    private final MetricsSynthesizer metricsSynthesizer;

    @Override
    public String getName() { return "run_metrics"; }

    @Override
    public String getDescription() {
        return "Get the last 24 hours of CPU and memory usage, one point per hour. " +
               "Use for charts, trends and capacity questions.";
    }

    @Override
    public Map<String, Object> getParameterSchema() {
        return Map.of("type", "object", "properties", Map.of());
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        try {
            MetricsSeries series = context.shared(ToolContext.METRICS, metricsSynthesizer::synthesizeLive);
            return ToolResult.metrics(series);
        } catch (RuntimeException e) {
            log.error("Metrics synthesis failed: {}", e.getMessage(), e);
            return ToolResult.error("Metrics unavailable: " + e.getMessage());
        }
    }
}
