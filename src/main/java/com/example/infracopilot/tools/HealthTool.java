package com.example.infracopilot.tools;

import com.example.infracopilot.agent.AgentTool;
import com.example.infracopilot.agent.ToolContext;
import com.example.infracopilot.agent.ToolResult;
import com.example.infracopilot.domain.UnifiedHealthReport;
import com.example.infracopilot.monitoring.HealthAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Health Tool - Runs one aggregation over the local host, Azure and the
 * custom endpoints.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HealthTool implements AgentTool {

    private final HealthAggregator healthAggregator;

    @Override
    public String getName() { return "run_health"; }

    @Override
    public String getDescription() {
        return "Check current health: local CPU, memory, disk and uptime, Azure VMs, App Services and " +
               "Storage Accounts, and the configured HTTP endpoints. " +
               "Use for status, uptime, warnings or endpoint questions.";
    }

    @Override
    public Map<String, Object> getParameterSchema() {
        return Map.of("type", "object", "properties", Map.of());
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        try {
            UnifiedHealthReport report = context.shared(ToolContext.HEALTH, healthAggregator::aggregate);
            return ToolResult.health(report);
        } catch (RuntimeException e) {
            log.error("Health aggregation failed: {}", e.getMessage(), e);
            return ToolResult.error("Health check failed: " + e.getMessage());
        }
    }
}
