package com.example.infracopilot.agent;

import com.example.infracopilot.domain.MetricsSeries;
import com.example.infracopilot.domain.ReportContext;
import com.example.infracopilot.domain.UnifiedHealthReport;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Result of one agent turn. Payload fields are null when the corresponding
 * tool did not run or failed; failures are listed in {@code toolErrors}.
 */
@Value
@Builder
public class AgentResponse {

    @Builder.Default
    boolean ok = true;

    String sessionId;
    String text;

    @Singular("toolUsed")
    List<String> toolsUsed;

    String reasoning;
    UnifiedHealthReport health;
    MetricsSeries metrics;
    ReportContext report;
    String reportMarkdown;

    @Builder.Default
    Map<String, String> toolErrors = Map.of();

    String usedModel;
    Instant timestamp;
}
