package com.example.infracopilot.monitoring;

public interface CloudCredentialProvider {

    /**
     * @return a bearer token for the cloud management API
     * @throws CloudAuthenticationException if no token can be obtained
     */
    String acquireToken();
}
