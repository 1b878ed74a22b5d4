package com.example.infracopilot.agent;

import com.example.infracopilot.config.CopilotProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LlmClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private CopilotProperties properties;
    private LlmClient client;

    private final AgentTool healthTool = new AgentTool() {
        @Override
        public String getName() {
            return "run_health";
        }

        @Override
        public String getDescription() {
            return "Run the hybrid health check";
        }

        @Override
        public Map<String, Object> getParameterSchema() {
            return Map.of("type", "object", "properties", Map.of());
        }

        @Override
        public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
            return ToolResult.error("not used");
        }
    };

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        properties = new CopilotProperties();
        properties.getLlm().setApiKey("key-1");
        properties.getLlm().setModel("models/gemini-1.5-flash");
        properties.getLlm().setBaseUrl(server.url("/v1beta/").toString());
        properties.getLlm().setTimeoutSeconds(5);
        client = new LlmClient(properties, objectMapper, new OkHttpClient());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static List<AgentMessage> conversation() {
        return List.of(
                AgentMessage.system("You are InfraCopilot."),
                AgentMessage.user("how is prod?"),
                AgentMessage.assistant("All green."),
                AgentMessage.user("and now?"));
    }

    @Test
    void geminiRequestCarriesSystemInstructionAndFunctions() throws Exception {
        properties.getLlm().setProvider("gemini");
        server.enqueue(new MockResponse().setBody("""
                {"candidates":[{"content":{"role":"model","parts":[
                  {"functionCall":{"name":"run_health","args":{}}}
                ]}}]}"""));

        AgentMessage reply = client.chat(conversation(), List.of(healthTool), 0.0, 300);

        assertTrue(reply.hasToolCalls());
        assertEquals("run_health", reply.getToolCalls().get(0).getName());

        RecordedRequest request = server.takeRequest();
        assertEquals("/v1beta/models/gemini-1.5-flash:generateContent", request.getPath());
        assertEquals("key-1", request.getHeader("x-goog-api-key"));
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("You are InfraCopilot.", body.at("/systemInstruction/parts/0/text").asText());
        assertEquals(3, body.get("contents").size());
        assertEquals("model", body.at("/contents/1/role").asText());
        assertEquals("run_health", body.at("/tools/0/functionDeclarations/0/name").asText());
        assertEquals(300, body.at("/generationConfig/maxOutputTokens").asInt());
    }

    @Test
    void geminiTextPartsAreJoined() {
        properties.getLlm().setProvider("gemini");
        server.enqueue(new MockResponse().setBody("""
                {"candidates":[{"content":{"parts":[{"text":"## Health\\n"},{"text":"All good."}]}}]}"""));

        AgentMessage reply = client.chat(conversation(), List.of(), 0.35, 900);

        assertEquals("## Health\nAll good.", reply.getContent());
        assertFalse(reply.hasToolCalls());
    }

    @Test
    void openAiToolCallArgumentsAreDecoded() throws Exception {
        properties.getLlm().setProvider("openai");
        properties.getLlm().setModel("gpt-4o-mini");
        server.enqueue(new MockResponse().setBody("""
                {"choices":[{"message":{"role":"assistant","content":null,"tool_calls":[
                  {"id":"call_1","type":"function","function":{"name":"run_metrics","arguments":"{\\"range\\":\\"24h\\"}"}}
                ]}}]}"""));

        AgentMessage reply = client.chat(conversation(), List.of(healthTool), 0.0, 300);

        assertEquals("call_1", reply.getToolCalls().get(0).getId());
        assertEquals(Map.of("range", "24h"), reply.getToolCalls().get(0).getArguments());

        RecordedRequest request = server.takeRequest();
        assertEquals("/v1beta/chat/completions", request.getPath());
        assertEquals("Bearer key-1", request.getHeader("Authorization"));
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("gpt-4o-mini", body.get("model").asText());
        assertEquals(4, body.get("messages").size());
        assertEquals("function", body.at("/tools/0/type").asText());
    }

    @Test
    void unreadableToolCallArgumentsAreDropped() {
        properties.getLlm().setProvider("openai");
        properties.getLlm().setModel("gpt-4o-mini");
        server.enqueue(new MockResponse().setBody("""
                {"choices":[{"message":{"role":"assistant","content":null,"tool_calls":[
                  {"id":"call_1","type":"function","function":{"name":"run_health","arguments":"{not json"}}
                ]}}]}"""));

        AgentMessage reply = assertDoesNotThrow(() -> client.chat(conversation(), List.of(healthTool), 0.0, 300));

        assertEquals("run_health", reply.getToolCalls().get(0).getName());
        assertEquals(Map.of(), reply.getToolCalls().get(0).getArguments());
    }

    @Test
    void apiErrorBecomesNarrativeServiceException() {
        properties.getLlm().setProvider("gemini");
        server.enqueue(new MockResponse().setResponseCode(429)
                .setBody("{\"error\":{\"code\":429,\"message\":\"Quota exceeded\"}}"));

        NarrativeServiceException e = assertThrows(NarrativeServiceException.class,
                () -> client.chat(conversation(), List.of(), 0.35, 900));
        assertEquals("LLM API error 429: Quota exceeded", e.getMessage());
    }

    @Test
    void malformedResponseBecomesNarrativeServiceException() {
        properties.getLlm().setProvider("gemini");
        server.enqueue(new MockResponse().setBody("{\"promptFeedback\":{\"blockReason\":\"SAFETY\"}}"));

        assertThrows(NarrativeServiceException.class, () -> client.chat(conversation(), List.of(), 0.35, 900));
    }

    @Test
    void missingKeyFailsWithoutNetwork() {
        properties.getLlm().setApiKey("");

        NarrativeServiceException e = assertThrows(NarrativeServiceException.class,
                () -> client.chat(conversation(), List.of(), 0.35, 900));
        assertTrue(e.getMessage().contains("API key missing"));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void listsGeminiModels() {
        properties.getLlm().setProvider("gemini");
        server.enqueue(new MockResponse().setBody("""
                {"models":[
                  {"name":"models/gemini-1.5-flash","supportedGenerationMethods":["generateContent","countTokens"]},
                  {"name":"models/embedding-001","supportedGenerationMethods":["embedContent"]}
                ]}"""));

        List<LlmClient.ModelInfo> models = client.listModels();

        assertEquals(2, models.size());
        assertTrue(models.get(0).supportedMethods().contains("generateContent"));
        assertEquals("models/embedding-001", models.get(1).name());
    }

    @Test
    void normalizesGeminiModelName() {
        assertEquals("gemini-1.5-pro", LlmClient.normalizeModel(" models/gemini-1.5-pro "));
        assertEquals("gemini-1.5-pro", LlmClient.normalizeModel("gemini-1.5-pro"));
    }
}
