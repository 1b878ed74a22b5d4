package com.example.infracopilot.tools;

import com.example.infracopilot.agent.AgentMode;
import com.example.infracopilot.agent.AgentTool;
import com.example.infracopilot.agent.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Registers the agent tools at startup and checks that every explicit mode
 * can be served.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolRegistrationConfig {

    private final ToolRegistry toolRegistry;
    private final List<AgentTool> allTools;

    @EventListener(ApplicationReadyEvent.class)
    public void registerTools() {
        allTools.forEach(toolRegistry::register);
        verifyModes(toolRegistry);
        log.info("Tool registration complete. {} tools available: {}", toolRegistry.getToolCount(),
                toolRegistry.getAllTools().stream().map(AgentTool::getName).toList());
    }

    /**
     * @throws IllegalStateException if a mode routes to a tool nobody registered
     */
    static void verifyModes(ToolRegistry registry) {
        for (AgentMode mode : AgentMode.values()) {
            for (String tool : mode.getTools()) {
                if (registry.getTool(tool).isEmpty()) {
                    throw new IllegalStateException("Mode " + mode.wireName() + " needs unregistered tool " + tool);
                }
            }
        }
    }
}
