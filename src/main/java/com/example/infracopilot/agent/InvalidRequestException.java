package com.example.infracopilot.agent;

/**
 * Malformed agent input, rejected before any tool runs.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
