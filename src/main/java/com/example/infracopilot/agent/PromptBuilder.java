package com.example.infracopilot.agent;

import com.example.infracopilot.config.CopilotProperties;
import com.example.infracopilot.domain.ReportContext;
import com.example.infracopilot.domain.ToolOutputs;
import com.example.infracopilot.session.ConversationTurn;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles the prompts for the three narrative calls.
 *
 * Sections:
 * 1. Identity, shared by every prompt
 * 2. Task rules: routing, report writing or answering
 * 3. Tools, for routing only
 * 4. Safety
 * 5. Time
 */
@Component
@RequiredArgsConstructor
public class PromptBuilder {

    private final CopilotProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public String buildRouterPrompt(List<AgentTool> tools) {
        return buildIdentitySection()
                + buildRoutingSection()
                + buildToolsSection(tools)
                + buildTimeSection();
    }

    public String buildReportPrompt(ReportContext.Framing framing) {
        StringBuilder prompt = new StringBuilder(buildIdentitySection());
        prompt.append("""
                # Task
                Summarize infra health and metrics in plain English.
                Highlight risks and suggest NON-DESTRUCTIVE next actions only.
                Format output as Markdown with headings and bullet points.
                Be concise and actionable, and include a short risk score (Low/Med/High)
                consistent with the computed risk level.

                """);
        if (framing == ReportContext.Framing.DAILY) {
            prompt.append("""
                    This is today's daily report. End with a "Next Actions" section listing
                    concrete, safe follow-ups in priority order.

                    """);
        } else {
            prompt.append("Close with a short \"Next Actions\" section.\n\n");
        }
        prompt.append(buildSafetySection()).append(buildTimeSection());
        return prompt.toString();
    }

    public String buildReportInput(ReportContext report) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("framing", report.getFraming());
        payload.put("risk_level", report.getRiskLevel());
        payload.put("highlights", report.getHighlights());
        payload.put("local", report.getHealth() != null ? report.getHealth().getLocal() : null);
        payload.put("azure", report.getHealth() != null ? report.getHealth().getAzure() : null);
        payload.put("custom", report.getHealth() != null ? report.getHealth().getCustom() : null);
        payload.put("summary", report.getHealth() != null ? report.getHealth().getSummary() : null);
        payload.put("metrics", report.getMetrics());
        return "Generate the hybrid infra health report from this data.\n\nREPORT_CONTEXT (JSON):\n"
                + toJson(payload);
    }

    public String buildAnswerPrompt(boolean hasToolOutputs) {
        StringBuilder prompt = new StringBuilder(buildIdentitySection());
        if (hasToolOutputs) {
            prompt.append("""
                    # Task
                    Use TOOL_OUTPUTS to answer the user's question. Include:
                    - what you observed
                    - key values (cpu/mem/disk/uptime for health)
                    - warnings if any
                    - non-destructive next steps
                    Format with short headings and bullets.
                    Do NOT ask for clarification if TOOL_OUTPUTS already contains the needed info.
                    If TOOL_OUTPUTS come from an earlier turn, say so.

                    """);
        } else {
            prompt.append("""
                    # Task
                    Answer clearly and practically. Use brief headings and bullet points when helpful.

                    """);
        }
        prompt.append(buildSafetySection());
        return prompt.toString();
    }

    public String buildAnswerInput(NarrativeRequest request) {
        StringBuilder input = new StringBuilder();
        input.append("USER_QUESTION:\n").append(request.getInput()).append("\n\n");
        input.append("ACTION:\n").append(request.getMode().wireName());
        if (request.getToolsUsed() != null && !request.getToolsUsed().isEmpty()) {
            input.append(" (").append(String.join(", ", request.getToolsUsed())).append(")");
        }
        input.append("\n");
        if (request.getReasoning() != null) {
            input.append("WHY:\n").append(request.getReasoning()).append("\n");
        }
        ToolOutputs outputs = request.getOutputs();
        if (outputs != null && !outputs.isEmpty()) {
            input.append("\nTOOL_OUTPUTS")
                    .append(request.isOutputsFromHistory() ? " (from an earlier turn)" : "")
                    .append(" (JSON):\n")
                    .append(truncate(toJson(outputs), properties.getAgent().getMaxToolOutputChars()));
        }
        if (outputs != null && !outputs.getErrors().isEmpty()) {
            input.append("\nTOOL_ERRORS:\n");
            outputs.getErrors().forEach((tool, error) -> input.append("- ").append(tool).append(": ").append(error).append("\n"));
        }
        return input.toString();
    }

    /** Prior turns as model messages, oldest first. */
    public List<AgentMessage> buildHistory(List<ConversationTurn> history) {
        List<AgentMessage> messages = new ArrayList<>();
        for (ConversationTurn turn : history) {
            if (turn.getText() == null || turn.getText().isBlank()) {
                continue;
            }
            messages.add(turn.getRole() == ConversationTurn.Role.USER
                    ? AgentMessage.user(turn.getText())
                    : AgentMessage.assistant(turn.getText()));
        }
        return messages;
    }

    private String buildIdentitySection() {
        return """
                # Identity
                You are InfraCopilot, a ChatOps SRE assistant for a hybrid environment:
                the local host, Azure resources and custom HTTP endpoints.
                You are concise, practical and read-only.

                """;
    }

    private String buildRoutingSection() {
        return """
                # Routing
                Decide which tools must run to answer the user. Rules:
                - health, status, uptime, warnings, endpoints, local system => run_health
                - charts, trends, last 24h, metrics => run_metrics
                - report, summary, daily report => run_report
                - a follow-up such as "give details" about data already shown => no tools
                - anything else => no tools
                Prefer calling the tools directly. If you cannot, return ONLY a JSON object:
                {"tools": ["run_health"], "reasoning": "short reason"}
                Use an empty list when no tool is needed.

                """;
    }

    private String buildToolsSection(List<AgentTool> tools) {
        if (tools == null || tools.isEmpty()) {
            return "# Available Tools\nNo tools currently available.\n\n";
        }
        StringBuilder section = new StringBuilder("# Available Tools\n");
        for (AgentTool tool : tools) {
            section.append(String.format("- **%s**: %s\n", tool.getName(), tool.getDescription()));
        }
        section.append("\n");
        return section.toString();
    }

    private String buildSafetySection() {
        return """
                # Safety
                - NEVER suggest destructive commands; offer read-only alternatives instead
                - NEVER expose secrets, credentials or tokens

                """;
    }

    private String buildTimeSection() {
        return "# Time\nCurrent time (UTC): " + clock.instant() + "\n";
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Tool output is not serializable", e);
        }
    }

    private static String truncate(String text, int maxLength) {
        return text.length() > maxLength ? text.substring(0, maxLength) + "\n...[truncated]" : text;
    }
}
