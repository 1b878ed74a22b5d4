package com.example.infracopilot.monitoring;

/**
 * Raised when a cloud access token cannot be obtained.
 */
public class CloudAuthenticationException extends RuntimeException {

    public CloudAuthenticationException(String message) {
        super(message);
    }

    public CloudAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
