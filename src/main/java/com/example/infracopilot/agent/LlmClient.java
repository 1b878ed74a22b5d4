package com.example.infracopilot.agent;

import com.example.infracopilot.config.CopilotProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * HTTP client for the language model.
 *
 * Two wire formats are supported:
 * - openai: any OpenAI-compatible chat completions API, with function calling
 * - gemini: Google generateContent, with function declarations
 *
 * Every failure surfaces as {@link NarrativeServiceException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmClient {

    static final String OPENAI_BASE_URL = "https://api.openai.com/v1";
    static final String GEMINI_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";
    private static final MediaType JSON = MediaType.get("application/json");

    private final CopilotProperties properties;
    private final ObjectMapper objectMapper;
    private final OkHttpClient httpClient;

    public record ModelInfo(String name, List<String> supportedMethods) {
    }

    /**
     * Sends a conversation, optionally offering tools, and returns the
     * assistant message with any tool calls it made.
     */
    public AgentMessage chat(List<AgentMessage> messages, List<AgentTool> tools, double temperature, int maxTokens) {
        CopilotProperties.LlmConfig llm = requireConfigured();
        boolean gemini = isGemini(llm);
        try {
            String body = gemini
                    ? buildGeminiBody(messages, tools, temperature, maxTokens)
                    : buildOpenAiBody(llm, messages, tools, temperature, maxTokens);
            Request.Builder request = new Request.Builder().post(RequestBody.create(body, JSON));
            if (gemini) {
                request.url(baseUrl(llm) + "/models/" + normalizeModel(llm.getModel()) + ":generateContent")
                        .addHeader("x-goog-api-key", llm.getApiKey());
            } else {
                request.url(baseUrl(llm) + "/chat/completions")
                        .addHeader("Authorization", "Bearer " + llm.getApiKey());
            }
            log.debug("LLM request: provider={}, messages={}, tools={}", llm.getProvider(), messages.size(), tools.size());

            JsonNode root = execute(request.build());
            return gemini ? parseGemini(root) : parseOpenAi(root);
        } catch (IOException e) {
            throw new NarrativeServiceException("Failed to reach LLM: " + e.getMessage(), e);
        }
    }

    /**
     * Models visible to the configured key.
     */
    public List<ModelInfo> listModels() {
        CopilotProperties.LlmConfig llm = properties.getLlm();
        if (isBlank(llm.getApiKey())) {
            throw new NarrativeServiceException("LLM API key missing (set GEMINI_API_KEY or LLM_API_KEY)");
        }
        Request.Builder request = new Request.Builder().url(baseUrl(llm) + "/models").get();
        if (isGemini(llm)) {
            request.addHeader("x-goog-api-key", llm.getApiKey());
        } else {
            request.addHeader("Authorization", "Bearer " + llm.getApiKey());
        }
        try {
            JsonNode root = execute(request.build());
            List<ModelInfo> models = new ArrayList<>();
            if (isGemini(llm)) {
                for (JsonNode model : root.path("models")) {
                    List<String> methods = new ArrayList<>();
                    model.path("supportedGenerationMethods").forEach(m -> methods.add(m.asText()));
                    models.add(new ModelInfo(model.path("name").asText(), methods));
                }
            } else {
                for (JsonNode model : root.path("data")) {
                    models.add(new ModelInfo(model.path("id").asText(), List.of("chat.completions")));
                }
            }
            return models;
        } catch (IOException e) {
            throw new NarrativeServiceException("Failed to list models: " + e.getMessage(), e);
        }
    }

    public String getModelId() {
        return properties.getLlm().getModel();
    }

    private JsonNode execute(Request request) throws IOException {
        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(Duration.ofSeconds(properties.getLlm().getTimeoutSeconds()))
                .build();
        try (Response response = client.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                String detail = errorMessage(body);
                log.error("LLM API error: {} - {}", response.code(), detail);
                throw new NarrativeServiceException("LLM API error " + response.code() + ": " + detail);
            }
            try {
                return objectMapper.readTree(body);
            } catch (JsonProcessingException e) {
                throw new NarrativeServiceException("Malformed LLM response: " + e.getOriginalMessage(), e);
            }
        }
    }

    private String buildOpenAiBody(CopilotProperties.LlmConfig llm, List<AgentMessage> messages,
                                   List<AgentTool> tools, double temperature, int maxTokens) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", llm.getModel());
        root.put("temperature", temperature);
        root.put("max_tokens", maxTokens);

        ArrayNode messagesArray = root.putArray("messages");
        for (AgentMessage msg : messages) {
            ObjectNode msgNode = messagesArray.addObject();
            msgNode.put("role", msg.getRole().name().toLowerCase(Locale.ROOT));
            msgNode.put("content", msg.getContent() != null ? msg.getContent() : "");
        }

        if (!tools.isEmpty()) {
            ArrayNode toolsArray = root.putArray("tools");
            for (AgentTool tool : tools) {
                ObjectNode toolNode = toolsArray.addObject();
                toolNode.put("type", "function");
                ObjectNode funcNode = toolNode.putObject("function");
                funcNode.put("name", tool.getName());
                funcNode.put("description", tool.getDescription());
                funcNode.set("parameters", objectMapper.valueToTree(tool.getParameterSchema()));
            }
        }
        return objectMapper.writeValueAsString(root);
    }

    private String buildGeminiBody(List<AgentMessage> messages, List<AgentTool> tools,
                                   double temperature, int maxTokens) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode contents = root.putArray("contents");
        StringBuilder system = new StringBuilder();

        for (AgentMessage msg : messages) {
            if (msg.getRole() == AgentMessage.Role.SYSTEM) {
                if (system.length() > 0) {
                    system.append("\n\n");
                }
                system.append(msg.getContent());
                continue;
            }
            ObjectNode content = contents.addObject();
            content.put("role", msg.getRole() == AgentMessage.Role.ASSISTANT ? "model" : "user");
            content.putArray("parts").addObject().put("text", msg.getContent() != null ? msg.getContent() : "");
        }

        if (system.length() > 0) {
            ObjectNode instruction = root.putObject("systemInstruction");
            instruction.put("role", "system");
            instruction.putArray("parts").addObject().put("text", system.toString());
        }

        if (!tools.isEmpty()) {
            ArrayNode declarations = root.putArray("tools").addObject().putArray("functionDeclarations");
            for (AgentTool tool : tools) {
                ObjectNode declaration = declarations.addObject();
                declaration.put("name", tool.getName());
                declaration.put("description", tool.getDescription());
                declaration.set("parameters", objectMapper.valueToTree(tool.getParameterSchema()));
            }
        }

        ObjectNode generation = root.putObject("generationConfig");
        generation.put("temperature", temperature);
        generation.put("maxOutputTokens", maxTokens);
        return objectMapper.writeValueAsString(root);
    }

    private AgentMessage parseOpenAi(JsonNode root) {
        JsonNode choices = root.get("choices");
        if (choices == null || !choices.isArray() || choices.isEmpty() || !choices.get(0).has("message")) {
            throw new NarrativeServiceException("Malformed LLM response: no choices");
        }
        JsonNode message = choices.get(0).get("message");
        String content = message.hasNonNull("content") ? message.get("content").asText() : null;

        List<AgentMessage.ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode tc : message.path("tool_calls")) {
            JsonNode function = tc.path("function");
            String rawArgs = function.path("arguments").asText("");
            toolCalls.add(AgentMessage.ToolCall.builder()
                    .id(tc.path("id").asText(UUID.randomUUID().toString()))
                    .name(function.path("name").asText())
                    .arguments(readArguments(parseArguments(rawArgs)))
                    .build());
        }
        return AgentMessage.builder()
                .role(AgentMessage.Role.ASSISTANT)
                .content(content)
                .toolCalls(toolCalls)
                .build();
    }

    private AgentMessage parseGemini(JsonNode root) {
        JsonNode candidates = root.get("candidates");
        if (candidates == null || !candidates.isArray() || candidates.isEmpty()) {
            throw new NarrativeServiceException("Malformed LLM response: no candidates");
        }
        StringBuilder text = new StringBuilder();
        List<AgentMessage.ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode part : candidates.get(0).path("content").path("parts")) {
            if (part.has("text")) {
                text.append(part.get("text").asText());
            }
            if (part.has("functionCall")) {
                JsonNode call = part.get("functionCall");
                toolCalls.add(AgentMessage.ToolCall.builder()
                        .id(UUID.randomUUID().toString())
                        .name(call.path("name").asText())
                        .arguments(readArguments(call.get("args")))
                        .build());
            }
        }
        return AgentMessage.builder()
                .role(AgentMessage.Role.ASSISTANT)
                .content(text.toString().trim())
                .toolCalls(toolCalls)
                .build();
    }

    /**
     * OpenAI sends function arguments as a JSON-encoded string. Unreadable
     * arguments drop to none; the call itself still stands.
     */
    private JsonNode parseArguments(String raw) {
        if (raw.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring unreadable tool call arguments: {}", e.getOriginalMessage());
            return null;
        }
    }

    private Map<String, Object> readArguments(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return objectMapper.convertValue(node,
                objectMapper.getTypeFactory().constructMapType(LinkedHashMap.class, String.class, Object.class));
    }

    private String errorMessage(String body) {
        try {
            JsonNode message = objectMapper.readTree(body).path("error").path("message");
            if (message.isTextual()) {
                return message.asText();
            }
        } catch (JsonProcessingException e) {
            log.trace("Error body is not JSON: {}", e.getOriginalMessage());
        }
        return body.length() > 300 ? body.substring(0, 300) : body;
    }

    private CopilotProperties.LlmConfig requireConfigured() {
        CopilotProperties.LlmConfig llm = properties.getLlm();
        if (isBlank(llm.getApiKey())) {
            throw new NarrativeServiceException("LLM API key missing (set GEMINI_API_KEY or LLM_API_KEY)");
        }
        if (isBlank(llm.getModel())) {
            throw new NarrativeServiceException("LLM model missing (set GEMINI_MODEL or LLM_MODEL)");
        }
        return llm;
    }

    private static boolean isGemini(CopilotProperties.LlmConfig llm) {
        return "gemini".equalsIgnoreCase(llm.getProvider());
    }

    private static String baseUrl(CopilotProperties.LlmConfig llm) {
        String base = !isBlank(llm.getBaseUrl()) ? llm.getBaseUrl().trim()
                : isGemini(llm) ? GEMINI_BASE_URL : OPENAI_BASE_URL;
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    /** Gemini model names may be given as "models/gemini-..."; the URL wants the bare name. */
    static String normalizeModel(String model) {
        String trimmed = model.trim();
        return trimmed.startsWith("models/") ? trimmed.substring("models/".length()) : trimmed;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
