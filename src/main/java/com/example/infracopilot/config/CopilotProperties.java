package com.example.infracopilot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Central configuration for InfraCopilot.
 * Maps to the 'infra-copilot' prefix in application.yml; secrets and scope
 * identifiers are bound from environment variables there.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "infra-copilot")
public class CopilotProperties {

    private LlmConfig llm = new LlmConfig();
    private LocalConfig local = new LocalConfig();
    private AzureConfig azure = new AzureConfig();
    private EndpointsConfig endpoints = new EndpointsConfig();
    private SessionConfig sessions = new SessionConfig();
    private AgentConfig agent = new AgentConfig();

    @Data
    public static class LlmConfig {
        /** openai (any OpenAI-compatible chat completions API) or gemini */
        private String provider = "openai";
        private String model = "";
        private String apiKey = "";
        /** Overrides the provider's default base URL when set. */
        private String baseUrl = "";
        private double temperature = 0.35;
        private int maxTokens = 900;
        private int timeoutSeconds = 60;
    }

    @Data
    public static class LocalConfig {
        private double cpuWarnPercent = 85;
        private double memoryWarnPercent = 90;
        private double diskWarnPercent = 90;
        /** Filesystem root whose usage is reported as disk_percent. */
        private String diskPath = "/";
    }

    @Data
    public static class AzureConfig {
        private String subscriptionId = "";
        private String resourceGroup = "";
        private String tenantId = "";
        private String clientId = "";
        private String clientSecret = "";
        /** Pre-issued bearer token; skips the client-credentials flow when set. */
        private String accessToken = "";
        private String managementUrl = "https://management.azure.com";
        private String loginUrl = "https://login.microsoftonline.com";
        /** Per-request timeout against the login and management APIs. */
        private int timeoutSeconds = 30;
        /** Budget for the whole cloud branch of one aggregation. */
        private int checkTimeoutSeconds = 60;
        private String vmApiVersion = "2024-03-01";
        private String webApiVersion = "2024-04-01";
        private String storageApiVersion = "2023-01-01";
    }

    @Data
    public static class EndpointsConfig {
        /** Probe timeout for targets that set none; fractional seconds allowed. */
        private double defaultTimeoutSeconds = 5;
        private List<Target> targets = new ArrayList<>();
        /**
         * JSON list of {"name": ..., "url": ...} objects, as supplied through
         * CUSTOM_ENDPOINTS. Appended after {@link #targets}.
         */
        private String json = "";

        @Data
        public static class Target {
            private String name;
            private String url;
            /** Per-endpoint override; 0 means use the default. */
            private long timeoutMillis;
        }
    }

    @Data
    public static class SessionConfig {
        private int idleTimeoutMinutes = 60;
        /** Turns kept per session; a user message and its answer are two turns. */
        private int maxTurns = 20;
        private int maxSessions = 1000;
    }

    @Data
    public static class AgentConfig {
        /** Upper bound on one turn's tool fan-out before it is reported as failed. */
        private int toolTimeoutSeconds = 90;
        /** Characters of serialized tool output handed to the narrative service. */
        private int maxToolOutputChars = 12000;
    }
}
