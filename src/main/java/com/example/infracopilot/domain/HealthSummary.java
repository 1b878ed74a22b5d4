package com.example.infracopilot.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Counts over every individually evaluated check: the local machine, each
 * listed cloud resource and each endpoint. {@code total == healthy + warnings}.
 */
@Value
@Builder
@Jacksonized
public class HealthSummary {
    int total;
    int healthy;
    int warnings;

    /**
     * Recomputes the counts from the three sections. A cloud check that never
     * got to list anything contributes no entries.
     */
    public static HealthSummary compute(LocalHealthSnapshot local, CloudHealthSnapshot azure, EndpointChecks custom) {
        int total = 1;
        int degraded = local.isHealthy() ? 0 : 1;
        for (CloudResource resource : azure.getResources()) {
            total++;
            if (!resource.isHealthy()) {
                degraded++;
            }
        }
        for (EndpointCheckResult result : custom.getResults()) {
            total++;
            if (!result.isUp()) {
                degraded++;
            }
        }
        return HealthSummary.builder()
                .total(total)
                .healthy(total - degraded)
                .warnings(degraded)
                .build();
    }
}
