package com.example.infracopilot.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Merged view of all health sources for one aggregation call.
 * Warnings are ordered local, then cloud, then endpoints in declaration order.
 */
@Value
@Builder
@Jacksonized
public class UnifiedHealthReport {

    Instant timestamp;
    HealthSummary summary;

    @Singular
    List<String> warnings;

    LocalHealthSnapshot local;
    CloudHealthSnapshot azure;
    EndpointChecks custom;
}
