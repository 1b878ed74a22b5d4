package com.example.infracopilot.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Result of probing one configured HTTP endpoint.
 * A DOWN result carries {@code error}; {@code httpStatus} is only present when a
 * response was actually received.
 */
@Value
@Builder
@Jacksonized
public class EndpointCheckResult {

    public enum Status {
        UP, DOWN
    }

    String name;
    String url;
    Status status;

    @JsonProperty("http_status")
    Integer httpStatus;

    @JsonProperty("latency_ms")
    Long latencyMs;

    String error;

    @JsonIgnore
    public boolean isUp() {
        return status == Status.UP;
    }

    public static EndpointCheckResult down(String name, String url, String error, Long latencyMs) {
        return EndpointCheckResult.builder()
                .name(name)
                .url(url)
                .status(Status.DOWN)
                .latencyMs(latencyMs)
                .error(error)
                .build();
    }
}
