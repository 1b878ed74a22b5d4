package com.example.infracopilot.monitoring;

import java.time.Duration;

/** One configured HTTP endpoint with its resolved timeout. */
public record EndpointTarget(String name, String url, Duration timeout) {
}
