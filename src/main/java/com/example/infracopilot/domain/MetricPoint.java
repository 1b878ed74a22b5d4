package com.example.infracopilot.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;

@Value
public class MetricPoint {

    @JsonProperty("t")
    Instant timestamp;

    @JsonProperty("v")
    double value;

    public MetricPoint(@JsonProperty("t") Instant timestamp, @JsonProperty("v") double value) {
        this.timestamp = timestamp;
        this.value = value;
    }
}
