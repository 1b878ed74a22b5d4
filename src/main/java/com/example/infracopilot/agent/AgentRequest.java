package com.example.infracopilot.agent;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.regex.Pattern;

/**
 * A validated agent turn request.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AgentRequest {

    private static final Pattern SESSION_ID = Pattern.compile("^[A-Za-z0-9._:-]{1,128}$");

    String input;
    AgentMode mode;
    /** Null when the caller starts a new conversation. */
    String sessionId;

    /**
     * @throws InvalidRequestException on an unsupported mode or a malformed session id
     */
    public static AgentRequest of(String input, String mode, String sessionId) {
        AgentMode parsedMode = AgentMode.fromValue(mode);
        String id = sessionId == null || sessionId.isBlank() ? null : sessionId.trim();
        if (id != null && !SESSION_ID.matcher(id).matches()) {
            throw new InvalidRequestException(
                    "Invalid sessionId: expected 1-128 characters from [A-Za-z0-9._:-]");
        }
        return new AgentRequest(input == null ? "" : input.trim(), parsedMode, id);
    }
}
