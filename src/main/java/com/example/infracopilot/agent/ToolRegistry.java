package com.example.infracopilot.agent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for the tools the agent can route to. Populated at startup.
 */
@Slf4j
@Component
public class ToolRegistry {

    private final Map<String, AgentTool> tools = new ConcurrentHashMap<>();

    public void register(AgentTool tool) {
        tools.put(tool.getName(), tool);
        log.info("Registered tool: {}", tool.getName());
    }

    public Optional<AgentTool> getTool(String name) {
        return Optional.ofNullable(name != null ? tools.get(name) : null);
    }

    /**
     * All tools ordered by name, so prompts and listings are stable.
     */
    public List<AgentTool> getAllTools() {
        List<AgentTool> sorted = new ArrayList<>(tools.values());
        sorted.sort(Comparator.comparing(AgentTool::getName));
        return sorted;
    }

    /**
     * Name, description and schema of every tool.
     */
    public List<Map<String, Object>> describeTools() {
        return getAllTools().stream()
                .map(tool -> {
                    Map<String, Object> info = new LinkedHashMap<>();
                    info.put("name", tool.getName());
                    info.put("description", tool.getDescription());
                    info.put("parameters", tool.getParameterSchema());
                    return info;
                })
                .toList();
    }

    public int getToolCount() {
        return tools.size();
    }
}
