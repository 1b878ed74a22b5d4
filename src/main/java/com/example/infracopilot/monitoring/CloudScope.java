package com.example.infracopilot.monitoring;

import com.example.infracopilot.config.CopilotProperties;

/**
 * Where to list cloud resources. Both identifiers must be present for the
 * cloud check to count as configured.
 */
public record CloudScope(String subscriptionId, String resourceGroup) {

    public boolean isConfigured() {
        return subscriptionId != null && !subscriptionId.isBlank()
                && resourceGroup != null && !resourceGroup.isBlank();
    }

    public static CloudScope from(CopilotProperties.AzureConfig config) {
        return new CloudScope(config.getSubscriptionId(), config.getResourceGroup());
    }
}
