package com.example.infracopilot.agent;

import java.util.Map;

/**
 * Contract for the operations the agent may run on behalf of a request.
 * Descriptors (name, description, schema) are what the narrative service sees
 * when it selects tools.
 */
public interface AgentTool {

    /**
     * Unique tool name, e.g. "run_health".
     */
    String getName();

    /**
     * When to use the tool, written for the model.
     */
    String getDescription();

    /**
     * JSON Schema of the accepted arguments.
     */
    Map<String, Object> getParameterSchema();

    /**
     * Runs the tool for one turn. Failures that only degrade this tool's
     * payload are returned as {@link ToolResult#error(String)}.
     *
     * @throws NarrativeServiceException if the narrative service is needed and unavailable
     */
    ToolResult execute(Map<String, Object> parameters, ToolContext context);
}
