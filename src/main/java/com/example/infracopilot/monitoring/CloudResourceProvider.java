package com.example.infracopilot.monitoring;

import com.example.infracopilot.domain.CloudResource;

import java.util.List;

/**
 * Lists the resources of one scope and maps each provider state to healthy or
 * unhealthy. A kind whose listing fails is reported in {@link Listing#failures()}
 * rather than failing the whole call.
 */
public interface CloudResourceProvider {

    Listing listResources(CloudScope scope, String accessToken);

    record Listing(List<CloudResource> vms,
                   List<CloudResource> appServices,
                   List<CloudResource> storageAccounts,
                   List<String> failures) {
    }
}
