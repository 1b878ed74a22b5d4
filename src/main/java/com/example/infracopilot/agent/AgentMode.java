package com.example.infracopilot.agent;

import java.util.List;
import java.util.Locale;

/**
 * Explicit routing override. {@link #AUTO} leaves the choice to the narrative
 * service.
 */
public enum AgentMode {
    AUTO(List.of()),
    HEALTH(List.of("run_health")),
    METRICS(List.of("run_metrics")),
    REPORT(List.of("run_health", "run_metrics", "run_report")),
    DAILY_REPORT(List.of("run_health", "run_metrics", "run_report"));

    private final List<String> tools;

    AgentMode(List<String> tools) {
        this.tools = tools;
    }

    /** Tools a non-auto mode runs, in execution order. */
    public List<String> getTools() {
        return tools;
    }

    /**
     * Parses a wire value such as "daily_report". Null or blank means AUTO.
     *
     * @throws InvalidRequestException for any other value
     */
    public static AgentMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Unsupported mode: " + value
                    + " (expected auto, health, metrics, report or daily_report)");
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
