package com.example.infracopilot.session;

import com.example.infracopilot.domain.ToolOutputs;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * One entry in a conversation. Agent turns carry the tools that ran and what
 * they produced; user turns carry text only.
 */
@Value
@Builder
@Jacksonized
public class ConversationTurn {

    public enum Role {
        USER, AGENT
    }

    Role role;
    String text;

    @Singular("toolRun")
    List<String> toolsRun;

    ToolOutputs toolOutputs;
    Instant timestamp;

    public static ConversationTurn user(String text, Instant timestamp) {
        return ConversationTurn.builder()
                .role(Role.USER)
                .text(text)
                .timestamp(timestamp)
                .build();
    }

    public static ConversationTurn agent(String text, List<String> toolsRun, ToolOutputs outputs, Instant timestamp) {
        return ConversationTurn.builder()
                .role(Role.AGENT)
                .text(text)
                .toolsRun(toolsRun)
                .toolOutputs(outputs)
                .timestamp(timestamp)
                .build();
    }
}
