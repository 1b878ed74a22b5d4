package com.example.infracopilot.agent;

/**
 * The narrative service could not produce a usable response: missing
 * configuration, transport failure, an error status or a malformed body.
 * Aborts the current agent turn.
 */
public class NarrativeServiceException extends RuntimeException {

    public NarrativeServiceException(String message) {
        super(message);
    }

    public NarrativeServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
