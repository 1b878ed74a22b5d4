package com.example.infracopilot.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CloudResource {

    public enum Kind {
        VM, APP_SERVICE, STORAGE_ACCOUNT
    }

    String name;
    Kind kind;
    /** Provider state as reported: power state, site state or provisioning state. */
    String state;
    boolean healthy;
}
