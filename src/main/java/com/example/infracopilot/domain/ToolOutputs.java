package com.example.infracopilot.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Payloads produced by the tools of one agent turn. A tool that did not run,
 * or failed, leaves its field null; failures are listed in {@code errors}
 * keyed by tool name.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ToolOutputs {

    UnifiedHealthReport health;
    MetricsSeries metrics;
    ReportContext report;
    String reportMarkdown;

    @Builder.Default
    Map<String, String> errors = Map.of();

    @JsonIgnore
    public boolean isEmpty() {
        return health == null && metrics == null && report == null && reportMarkdown == null;
    }
}
