package com.example.infracopilot.monitoring;

import com.example.infracopilot.config.CopilotProperties;
import com.example.infracopilot.domain.CloudResource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Lists VMs, App Services and Storage Accounts of one resource group through
 * the Azure Resource Manager REST API.
 *
 * Healthy states:
 * - VM: power state running, stopped or deallocated
 * - App Service: site state Running
 * - Storage Account: provisioning state Succeeded
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AzureResourceProvider implements CloudResourceProvider {

    private static final Set<String> HEALTHY_VM_STATES = Set.of("running", "stopped", "deallocated");

    private final CopilotProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Override
    public Listing listResources(CloudScope scope, String accessToken) {
        CopilotProperties.AzureConfig azure = properties.getAzure();
        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(Duration.ofSeconds(azure.getTimeoutSeconds()))
                .build();
        ArmSession arm = new ArmSession(client, accessToken);

        String base = AzureClientCredentialProvider.trimSlash(azure.getManagementUrl());
        String group = base + "/subscriptions/" + scope.subscriptionId()
                + "/resourceGroups/" + scope.resourceGroup() + "/providers";
        List<String> failures = new ArrayList<>();

        List<CloudResource> vms = new ArrayList<>();
        try {
            String url = group + "/Microsoft.Compute/virtualMachines?api-version=" + azure.getVmApiVersion();
            for (JsonNode item : arm.list(url)) {
                String name = item.path("name").asText();
                String state = vmPowerState(arm, base + item.path("id").asText()
                        + "/instanceView?api-version=" + azure.getVmApiVersion());
                vms.add(resource(name, CloudResource.Kind.VM, state, HEALTHY_VM_STATES.contains(state)));
            }
        } catch (IOException e) {
            log.warn("Azure VM listing failed: {}", e.getMessage());
            failures.add("VM list failed - " + e.getMessage());
        }

        List<CloudResource> apps = new ArrayList<>();
        try {
            String url = group + "/Microsoft.Web/sites?api-version=" + azure.getWebApiVersion();
            for (JsonNode item : arm.list(url)) {
                String state = item.path("properties").path("state").asText("unknown");
                apps.add(resource(item.path("name").asText(), CloudResource.Kind.APP_SERVICE, state,
                        "running".equalsIgnoreCase(state)));
            }
        } catch (IOException e) {
            log.warn("Azure App Service listing failed: {}", e.getMessage());
            failures.add("AppService list failed - " + e.getMessage());
        }

        List<CloudResource> storage = new ArrayList<>();
        try {
            String url = group + "/Microsoft.Storage/storageAccounts?api-version=" + azure.getStorageApiVersion();
            for (JsonNode item : arm.list(url)) {
                String state = item.path("properties").path("provisioningState").asText("unknown");
                storage.add(resource(item.path("name").asText(), CloudResource.Kind.STORAGE_ACCOUNT, state,
                        "succeeded".equalsIgnoreCase(state)));
            }
        } catch (IOException e) {
            log.warn("Azure Storage listing failed: {}", e.getMessage());
            failures.add("Storage list failed - " + e.getMessage());
        }

        return new Listing(vms, apps, storage, failures);
    }

    /**
     * The power state lives in the instance view as a status code such as
     * "PowerState/running". A failed instance-view call leaves it "unknown".
     */
    private String vmPowerState(ArmSession arm, String instanceViewUrl) {
        try {
            JsonNode view = arm.get(instanceViewUrl);
            for (JsonNode status : view.path("statuses")) {
                String code = status.path("code").asText("");
                if (code.startsWith("PowerState/")) {
                    return code.substring("PowerState/".length());
                }
            }
        } catch (IOException e) {
            log.debug("Instance view unavailable at {}: {}", instanceViewUrl, e.getMessage());
        }
        return "unknown";
    }

    private static CloudResource resource(String name, CloudResource.Kind kind, String state, boolean healthy) {
        return CloudResource.builder().name(name).kind(kind).state(state).healthy(healthy).build();
    }

    private final class ArmSession {
        private final OkHttpClient client;
        private final String accessToken;

        private ArmSession(OkHttpClient client, String accessToken) {
            this.client = client;
            this.accessToken = accessToken;
        }

        /** Follows nextLink until the collection is exhausted. */
        List<JsonNode> list(String url) throws IOException {
            List<JsonNode> items = new ArrayList<>();
            String next = url;
            while (next != null && !next.isBlank()) {
                JsonNode page = get(next);
                page.path("value").forEach(items::add);
                JsonNode link = page.get("nextLink");
                next = link != null && !link.isNull() ? link.asText() : null;
            }
            return items;
        }

        JsonNode get(String url) throws IOException {
            Request request = new Request.Builder()
                    .url(url)
                    .addHeader("Authorization", "Bearer " + accessToken)
                    .get()
                    .build();
            try (Response response = client.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    throw new IOException("HTTP " + response.code() + " from " + request.url().encodedPath());
                }
                return objectMapper.readTree(response.body() != null ? response.body().string() : "{}");
            }
        }
    }
}
