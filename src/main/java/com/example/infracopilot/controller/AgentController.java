package com.example.infracopilot.controller;

import com.example.infracopilot.agent.AgentEngine;
import com.example.infracopilot.agent.AgentRequest;
import com.example.infracopilot.agent.AgentResponse;
import com.example.infracopilot.agent.LlmClient;
import com.example.infracopilot.agent.ToolRegistry;
import com.example.infracopilot.config.CopilotProperties;
import com.example.infracopilot.session.Session;
import com.example.infracopilot.session.SessionNotFoundException;
import com.example.infracopilot.session.SessionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Agent REST API Controller.
 */
@RestController
@RequiredArgsConstructor
public class AgentController {

    private final AgentEngine agentEngine;
    private final ToolRegistry toolRegistry;
    private final SessionStore sessionStore;
    private final LlmClient llmClient;
    private final CopilotProperties properties;

    /**
     * Runs one agent turn. Invalid input is rejected here, before the turn is
     * scheduled.
     */
    @PostMapping("/api/chat")
    public CompletableFuture<AgentResponse> chat(@RequestBody ChatRequest request) {
        AgentRequest agentRequest = AgentRequest.of(request.input(), request.mode(), request.sessionId());
        return agentEngine.run(agentRequest);
    }

    @GetMapping("/api/chat/sessions/{sessionId}")
    public ResponseEntity<Map<String, Object>> getSession(@PathVariable String sessionId) {
        Session session = sessionStore.find(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put("sessionId", session.getId());
        body.put("createdAt", session.getCreatedAt());
        body.put("lastAccessedAt", session.getLastAccessedAt());
        body.put("turns", session.getTurns());
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/api/chat/sessions/{sessionId}")
    public ResponseEntity<Map<String, Object>> deleteSession(@PathVariable String sessionId) {
        if (!sessionStore.remove(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        return ResponseEntity.ok(Map.of("ok", true, "sessionId", sessionId, "status", "deleted"));
    }

    /**
     * Tool descriptors as offered to the narrative service.
     */
    @GetMapping("/api/agent/tools")
    public ResponseEntity<Map<String, Object>> listTools() {
        return ResponseEntity.ok(Map.of("ok", true, "tools", toolRegistry.describeTools()));
    }

    /**
     * Models the configured LLM key can use, for picking a model name.
     */
    @GetMapping("/api/models")
    public ResponseEntity<Map<String, Object>> listModels() {
        List<Map<String, Object>> models = llmClient.listModels().stream()
                .map(model -> {
                    Map<String, Object> info = new LinkedHashMap<>();
                    info.put("name", model.name());
                    info.put("supports_generateContent", model.supportedMethods().contains("generateContent"));
                    info.put("supportedGenerationMethods", model.supportedMethods());
                    return info;
                })
                .toList();
        return ResponseEntity.ok(Map.of("ok", true, "provider", properties.getLlm().getProvider(), "models", models));
    }
}
