package com.example.infracopilot.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Structured input for narrative report generation. Carries data only; all
 * wording is left to the narrative service.
 */
@Value
@Builder
@Jacksonized
public class ReportContext {

    public enum Framing {
        /** Plain health + metrics summary. */
        STANDARD,
        /** Daily report with an explicit "Next Actions" section. */
        DAILY
    }

    public enum RiskLevel {
        LOW, MEDIUM, HIGH
    }

    Instant generatedAt;
    Framing framing;
    RiskLevel riskLevel;

    @Singular
    List<String> highlights;

    UnifiedHealthReport health;
    MetricsSeries metrics;
}
