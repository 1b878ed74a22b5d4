package com.example.infracopilot.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.stream.Stream;

/**
 * Outcome of the cloud resource check. {@link Status#NOT_CONFIGURED} is terminal
 * and distinct from {@link Status#AUTH_FAILED}: the former means the scope was
 * never set, the latter that credentials could not be obtained.
 */
@Value
@Builder
@Jacksonized
public class CloudHealthSnapshot {

    public enum Status {
        OK("ok"),
        WARNINGS("warnings"),
        NOT_CONFIGURED("not_configured"),
        AUTH_FAILED("auth_failed");

        private final String wireName;

        Status(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String getWireName() {
            return wireName;
        }
    }

    boolean configured;
    Status status;
    String message;

    @Singular
    List<CloudResource> vms;

    @Singular
    @JsonProperty("appServices")
    List<CloudResource> appServices;

    @Singular
    @JsonProperty("storageAccounts")
    List<CloudResource> storageAccounts;

    @Singular
    List<String> warnings;

    public static CloudHealthSnapshot notConfigured() {
        return CloudHealthSnapshot.builder()
                .configured(false)
                .status(Status.NOT_CONFIGURED)
                .message("Set AZURE_SUBSCRIPTION_ID and AZURE_RESOURCE_GROUP to enable Azure checks.")
                .build();
    }

    public static CloudHealthSnapshot authFailed(String reason) {
        return CloudHealthSnapshot.builder()
                .configured(true)
                .status(Status.AUTH_FAILED)
                .message("Azure auth failed: " + reason)
                .warning("AZURE: auth_failed - " + reason)
                .build();
    }

    /** All listed resources, VMs first, then app services, then storage accounts. */
    @JsonIgnore
    public List<CloudResource> getResources() {
        return Stream.of(vms, appServices, storageAccounts)
                .flatMap(List::stream)
                .toList();
    }
}
