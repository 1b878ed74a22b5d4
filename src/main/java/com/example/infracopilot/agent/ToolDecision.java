package com.example.infracopilot.agent;

import java.util.List;
import java.util.Map;

/**
 * Which tools to run for a turn, in order, with the selector's reasoning.
 * An empty list means "answer from the conversation alone".
 */
public record ToolDecision(List<ToolInvocation> tools, String reasoning) {

    public ToolDecision {
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public record ToolInvocation(String name, Map<String, Object> arguments) {

        public ToolInvocation {
            arguments = arguments == null ? Map.of() : arguments;
        }
    }

    public static ToolDecision none(String reasoning) {
        return new ToolDecision(List.of(), reasoning);
    }

    public static ToolDecision of(List<String> toolNames, String reasoning) {
        return new ToolDecision(toolNames.stream().map(name -> new ToolInvocation(name, Map.of())).toList(),
                reasoning);
    }

    public boolean isEmpty() {
        return tools.isEmpty();
    }

    public List<String> toolNames() {
        return tools.stream().map(ToolInvocation::name).toList();
    }
}
