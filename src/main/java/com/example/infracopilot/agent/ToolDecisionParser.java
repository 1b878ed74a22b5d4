package com.example.infracopilot.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a tool-selection reply from the model into a {@link ToolDecision}.
 *
 * Native function calls win. Otherwise the text is searched for a JSON object
 * of the form {"tools": [...], "reasoning": "..."}, optionally wrapped in a
 * markdown code fence; the router form {"action": "health", "why": "..."} is
 * accepted too. Anything else is an empty decision.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolDecisionParser {

    private static final Pattern CODE_BLOCK =
            Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```", Pattern.CASE_INSENSITIVE);

    private static final Map<String, List<String>> ACTIONS = Map.of(
            "chat", List.of(),
            "health", AgentMode.HEALTH.getTools(),
            "metrics", AgentMode.METRICS.getTools(),
            "report", AgentMode.REPORT.getTools(),
            "daily_report", AgentMode.DAILY_REPORT.getTools());

    private final ObjectMapper objectMapper;

    public ToolDecision parse(AgentMessage reply) {
        if (reply == null) {
            return ToolDecision.none(null);
        }
        if (reply.hasToolCalls()) {
            List<ToolDecision.ToolInvocation> invocations = new ArrayList<>();
            for (AgentMessage.ToolCall call : reply.getToolCalls()) {
                invocations.add(new ToolDecision.ToolInvocation(call.getName(), call.getArguments()));
            }
            return new ToolDecision(invocations, blankToNull(reply.getContent()));
        }
        return parseText(reply.getContent());
    }

    public ToolDecision parseText(String text) {
        if (text == null || text.isBlank()) {
            return ToolDecision.none(null);
        }
        JsonNode root = extractObject(text.trim());
        if (root == null) {
            log.debug("No JSON decision in selector output, running no tools");
            return ToolDecision.none(null);
        }

        String reasoning = firstText(root, "reasoning", "why");
        if (root.has("tools")) {
            return new ToolDecision(readTools(root.get("tools")), reasoning);
        }
        if (root.has("action")) {
            String action = root.path("action").asText("chat").trim().toLowerCase(Locale.ROOT);
            boolean needTools = !root.has("need_tools") || root.path("need_tools").asBoolean(true);
            List<String> tools = ACTIONS.getOrDefault(action, List.of());
            return needTools ? ToolDecision.of(tools, reasoning) : ToolDecision.none(reasoning);
        }
        return ToolDecision.none(reasoning);
    }

    private List<ToolDecision.ToolInvocation> readTools(JsonNode node) {
        List<ToolDecision.ToolInvocation> tools = new ArrayList<>();
        if (!node.isArray()) {
            return tools;
        }
        for (JsonNode item : node) {
            if (item.isTextual() && !item.asText().isBlank()) {
                tools.add(new ToolDecision.ToolInvocation(item.asText().trim(), Map.of()));
            } else if (item.isObject() && item.hasNonNull("name")) {
                Map<String, Object> args = new LinkedHashMap<>();
                JsonNode argsNode = item.has("arguments") ? item.get("arguments") : item.get("args");
                if (argsNode != null && argsNode.isObject()) {
                    args = objectMapper.convertValue(argsNode,
                            objectMapper.getTypeFactory().constructMapType(LinkedHashMap.class, String.class, Object.class));
                }
                tools.add(new ToolDecision.ToolInvocation(item.get("name").asText(), args));
            }
        }
        return tools;
    }

    /**
     * Whole text first, then the content of a code fence, then the span from
     * the first '{' to the last '}'.
     */
    private JsonNode extractObject(String text) {
        JsonNode node = readObject(text);
        if (node != null) {
            return node;
        }
        Matcher matcher = CODE_BLOCK.matcher(text);
        if (matcher.find()) {
            node = readObject(matcher.group(1).trim());
            if (node != null) {
                return node;
            }
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return readObject(text.substring(start, end + 1));
        }
        return null;
    }

    private JsonNode readObject(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isObject() ? node : null;
        } catch (Exception e) {
            log.trace("Not a JSON object: {}", e.getMessage());
            return null;
        }
    }

    private static String firstText(JsonNode root, String... fields) {
        for (String field : fields) {
            JsonNode value = root.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
