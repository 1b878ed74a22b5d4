package com.example.infracopilot.monitoring;

import java.io.IOException;
import java.time.Duration;

/**
 * Performs a single GET against a URL.
 */
public interface EndpointProbe {

    /**
     * @return the final HTTP status code after redirects
     * @throws IOException on timeout or connection failure
     */
    int probe(String url, Duration timeout) throws IOException;
}
