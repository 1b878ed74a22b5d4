package com.example.infracopilot.monitoring;

import com.example.infracopilot.domain.CloudHealthSnapshot;
import com.example.infracopilot.domain.CloudResource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Cloud adapter. Checks, in order:
 * 1. scope present, else NOT_CONFIGURED without touching credentials or network
 * 2. token obtainable, else AUTH_FAILED
 * 3. resource listing, OK when nothing is unhealthy and every kind listed
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CloudHealthSource implements HealthSource<CloudScope, CloudHealthSnapshot> {

    private final CloudCredentialProvider credentialProvider;
    private final CloudResourceProvider resourceProvider;

    @Override
    public CloudHealthSnapshot check(CloudScope scope) {
        if (scope == null || !scope.isConfigured()) {
            return CloudHealthSnapshot.notConfigured();
        }

        String token;
        try {
            token = credentialProvider.acquireToken();
        } catch (RuntimeException e) {
            log.warn("Azure authentication failed: {}", e.getMessage());
            return CloudHealthSnapshot.authFailed(e.getMessage());
        }

        CloudResourceProvider.Listing listing;
        try {
            listing = resourceProvider.listResources(scope, token);
        } catch (RuntimeException e) {
            log.warn("Azure resource listing failed: {}", e.getMessage(), e);
            return CloudHealthSnapshot.builder()
                    .configured(true)
                    .status(CloudHealthSnapshot.Status.WARNINGS)
                    .message("Azure checks failed: " + e.getMessage())
                    .warning("AZURE: check failed - " + e.getMessage())
                    .build();
        }

        CloudHealthSnapshot.CloudHealthSnapshotBuilder snapshot = CloudHealthSnapshot.builder()
                .configured(true)
                .vms(listing.vms())
                .appServices(listing.appServices())
                .storageAccounts(listing.storageAccounts());

        int warnings = 0;
        warnings += addWarnings(snapshot, "VM", listing.vms(), "state");
        warnings += addWarnings(snapshot, "AppService", listing.appServices(), "state");
        warnings += addWarnings(snapshot, "Storage", listing.storageAccounts(), "provisioningState");
        for (String failure : listing.failures()) {
            snapshot.warning("AZURE: " + failure);
            warnings++;
        }

        return snapshot
                .status(warnings == 0 ? CloudHealthSnapshot.Status.OK : CloudHealthSnapshot.Status.WARNINGS)
                .message("Azure checks executed.")
                .build();
    }

    private static int addWarnings(CloudHealthSnapshot.CloudHealthSnapshotBuilder snapshot, String label,
                                   List<CloudResource> resources, String stateName) {
        int count = 0;
        for (CloudResource resource : resources) {
            if (!resource.isHealthy()) {
                snapshot.warning(String.format("AZURE: %s %s %s=%s", label, resource.getName(), stateName,
                        resource.getState()));
                count++;
            }
        }
        return count;
    }
}
