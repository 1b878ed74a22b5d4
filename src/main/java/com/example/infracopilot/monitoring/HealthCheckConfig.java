package com.example.infracopilot.monitoring;

import com.example.infracopilot.config.CopilotProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything one aggregation needs: local thresholds, cloud scope, endpoints
 * in declaration order and the cloud branch budget.
 */
public record HealthCheckConfig(LocalThresholds thresholds,
                                CloudScope cloudScope,
                                List<EndpointTarget> endpoints,
                                Duration cloudTimeout) {

    public HealthCheckConfig {
        endpoints = List.copyOf(endpoints);
    }

    /**
     * Builds the configuration from properties. Endpoint entries without a name
     * or URL are dropped.
     *
     * @throws IllegalArgumentException if the endpoint JSON is not a list
     */
    public static HealthCheckConfig from(CopilotProperties properties, ObjectMapper objectMapper) {
        CopilotProperties.EndpointsConfig endpointsConfig = properties.getEndpoints();
        long defaultMillis = Math.round(endpointsConfig.getDefaultTimeoutSeconds() * 1000);
        List<EndpointTarget> targets = new ArrayList<>();

        for (CopilotProperties.EndpointsConfig.Target target : endpointsConfig.getTargets()) {
            addTarget(targets, target.getName(), target.getUrl(), target.getTimeoutMillis(), defaultMillis);
        }

        String json = endpointsConfig.getJson();
        if (json != null && !json.isBlank()) {
            JsonNode root;
            try {
                root = objectMapper.readTree(json);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("CUSTOM_ENDPOINTS is not valid JSON: " + e.getOriginalMessage(), e);
            }
            if (!root.isArray()) {
                throw new IllegalArgumentException("CUSTOM_ENDPOINTS is not a JSON list");
            }
            for (JsonNode entry : root) {
                addTarget(targets, entry.path("name").asText(null), entry.path("url").asText(null),
                        entry.path("timeout_ms").asLong(0), defaultMillis);
            }
        }

        return new HealthCheckConfig(
                LocalThresholds.from(properties.getLocal()),
                CloudScope.from(properties.getAzure()),
                targets,
                Duration.ofSeconds(properties.getAzure().getCheckTimeoutSeconds()));
    }

    private static void addTarget(List<EndpointTarget> targets, String name, String url,
                                  long timeoutMillis, long defaultMillis) {
        if (name == null || name.isBlank() || url == null || url.isBlank()) {
            return;
        }
        long millis = timeoutMillis > 0 ? timeoutMillis : defaultMillis;
        targets.add(new EndpointTarget(name.trim(), url.trim(), Duration.ofMillis(millis)));
    }
}
