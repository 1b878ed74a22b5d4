package com.example.infracopilot.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * The custom endpoint section of a report. Results are in declaration order.
 */
@Value
@Builder
@Jacksonized
public class EndpointChecks {

    boolean configured;

    @Singular
    List<EndpointCheckResult> results;

    @Singular
    List<String> warnings;
}
