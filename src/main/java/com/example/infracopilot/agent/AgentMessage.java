package com.example.infracopilot.agent;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * A message exchanged with the language model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentMessage {

    private Role role;
    private String content;
    private List<ToolCall> toolCalls;

    public enum Role {
        SYSTEM, USER, ASSISTANT
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public static AgentMessage system(String content) {
        return AgentMessage.builder().role(Role.SYSTEM).content(content).build();
    }

    public static AgentMessage user(String content) {
        return AgentMessage.builder().role(Role.USER).content(content).build();
    }

    public static AgentMessage assistant(String content) {
        return AgentMessage.builder().role(Role.ASSISTANT).content(content).build();
    }
}
