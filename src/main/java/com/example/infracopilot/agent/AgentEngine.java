package com.example.infracopilot.agent;

import com.example.infracopilot.config.CopilotProperties;
import com.example.infracopilot.domain.ReportContext;
import com.example.infracopilot.domain.ToolOutputs;
import com.example.infracopilot.session.ConversationTurn;
import com.example.infracopilot.session.Session;
import com.example.infracopilot.session.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The agent loop. One pass per request:
 * 1. Resolve intent: explicit mode, or tool selection by the narrative service
 * 2. Execute the selected tools concurrently, sharing intermediate results
 * 3. Compose the answer from the tool outputs and the session history
 * 4. Persist the user and agent turns together
 *
 * A failing tool only degrades its own payload. A narrative service failure
 * aborts the turn before anything is written to the session.
 */
@Slf4j
@Service
public class AgentEngine {

    static final String EMPTY_INPUT_REPLY = "Say something and I'll help.";

    private final NarrativeService narrativeService;
    private final ToolRegistry toolRegistry;
    private final SessionStore sessionStore;
    private final Executor toolExecutor;
    private final CopilotProperties properties;
    private final Clock clock;

    public AgentEngine(NarrativeService narrativeService,
                       ToolRegistry toolRegistry,
                       SessionStore sessionStore,
                       @Qualifier("toolExecutor") Executor toolExecutor,
                       CopilotProperties properties,
                       Clock clock) {
        this.narrativeService = narrativeService;
        this.toolRegistry = toolRegistry;
        this.sessionStore = sessionStore;
        this.toolExecutor = toolExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Runs a turn on the agent executor. The future fails with
     * {@link NarrativeServiceException} when no answer could be produced.
     */
    @Async("agentExecutor")
    public CompletableFuture<AgentResponse> run(AgentRequest request) {
        return CompletableFuture.completedFuture(handle(request));
    }

    public AgentResponse handle(AgentRequest request) {
        Session session = sessionStore.getOrCreate(request.getSessionId());
        String sessionId = session.getId();
        AgentMode mode = request.getMode();
        String input = request.getInput();

        if (input.isBlank() && mode == AgentMode.AUTO) {
            return AgentResponse.builder()
                    .sessionId(sessionId)
                    .text(EMPTY_INPUT_REPLY)
                    .usedModel(narrativeService.getModelId())
                    .timestamp(clock.instant())
                    .build();
        }
        if (input.isBlank()) {
            input = "Run " + mode.wireName().replace('_', ' ');
        }
        log.info("Agent turn for session {} (mode={}): {}", sessionId, mode.wireName(), truncate(input, 100));

        List<ConversationTurn> history = sessionStore.history(sessionId);

        ToolDecision decision = resolveIntent(mode, input, history);
        ReportContext.Framing framing = mode == AgentMode.DAILY_REPORT
                ? ReportContext.Framing.DAILY : ReportContext.Framing.STANDARD;
        ToolContext toolContext = new ToolContext(sessionId, framing);
        ExecutionOutcome outcome = execute(decision, toolContext);

        ToolOutputs outputs = outcome.outputs();
        boolean fromHistory = false;
        if (outputs.isEmpty()) {
            Optional<ToolOutputs> previous = latestOutputs(history);
            if (previous.isPresent()) {
                outputs = previous.get().toBuilder().errors(outcome.outputs().getErrors()).build();
                fromHistory = true;
            }
        }

        String text = narrativeService.answer(NarrativeRequest.builder()
                .input(input)
                .mode(mode)
                .history(history)
                .toolsUsed(outcome.toolsUsed())
                .reasoning(decision.reasoning())
                .outputs(outputs)
                .outputsFromHistory(fromHistory)
                .build());

        Instant now = clock.instant();
        ToolOutputs produced = outcome.outputs();
        sessionStore.append(sessionId,
                ConversationTurn.user(input, now),
                ConversationTurn.agent(text, outcome.toolsUsed(), produced, now));

        log.info("Agent turn for session {} completed: tools={}, errors={}",
                sessionId, outcome.toolsUsed(), produced.getErrors().keySet());

        return AgentResponse.builder()
                .sessionId(sessionId)
                .text(text)
                .toolsUsed(outcome.toolsUsed())
                .reasoning(decision.reasoning())
                .health(produced.getHealth())
                .metrics(produced.getMetrics())
                .report(produced.getReport())
                .reportMarkdown(produced.getReportMarkdown())
                .toolErrors(produced.getErrors())
                .usedModel(narrativeService.getModelId())
                .timestamp(now)
                .build();
    }

    private ToolDecision resolveIntent(AgentMode mode, String input, List<ConversationTurn> history) {
        if (mode != AgentMode.AUTO) {
            return ToolDecision.of(mode.getTools(), "Requested mode: " + mode.wireName());
        }
        ToolDecision decision = narrativeService.selectTools(history, input, toolRegistry.getAllTools());
        return decision != null ? decision : ToolDecision.none(null);
    }

    /**
     * Starts every selected tool at once and collects the results in selection
     * order. Unknown and repeated tool names are skipped.
     */
    private ExecutionOutcome execute(ToolDecision decision, ToolContext context) {
        Map<String, CompletableFuture<ToolResult>> running = new LinkedHashMap<>();
        Set<String> seen = new LinkedHashSet<>();
        long timeoutSeconds = properties.getAgent().getToolTimeoutSeconds();

        for (ToolDecision.ToolInvocation invocation : decision.tools()) {
            if (!seen.add(invocation.name())) {
                continue;
            }
            Optional<AgentTool> tool = toolRegistry.getTool(invocation.name());
            if (tool.isEmpty()) {
                log.warn("Ignoring unknown tool '{}' selected for session {}", invocation.name(), context.getSessionId());
                continue;
            }
            log.info("Executing tool: {}", invocation.name());
            running.put(invocation.name(), CompletableFuture
                    .supplyAsync(() -> tool.get().execute(invocation.arguments(), context), toolExecutor)
                    .orTimeout(timeoutSeconds, TimeUnit.SECONDS));
        }

        List<String> toolsUsed = new ArrayList<>();
        Map<String, String> errors = new LinkedHashMap<>();
        ToolOutputs.ToolOutputsBuilder outputs = ToolOutputs.builder();
        ToolResult report = null;

        for (Map.Entry<String, CompletableFuture<ToolResult>> entry : running.entrySet()) {
            String name = entry.getKey();
            toolsUsed.add(name);
            ToolResult result;
            try {
                result = entry.getValue().join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof NarrativeServiceException narrativeFailure) {
                    throw narrativeFailure;
                }
                String message = cause instanceof TimeoutException
                        ? "timed out after " + timeoutSeconds + "s"
                        : String.valueOf(cause.getMessage());
                log.error("Tool {} failed: {}", name, message, cause);
                errors.put(name, message);
                continue;
            }
            if (!result.isSuccess()) {
                log.warn("Tool {} reported an error: {}", name, result.getError());
                errors.put(name, result.getError());
                continue;
            }
            if (result.getHealth() != null) {
                outputs.health(result.getHealth());
            }
            if (result.getMetrics() != null) {
                outputs.metrics(result.getMetrics());
            }
            if (result.getReport() != null) {
                report = result;
            }
        }

        if (report != null) {
            outputs.report(report.getReport()).reportMarkdown(report.getReportMarkdown());
        }
        return new ExecutionOutcome(toolsUsed, outputs.errors(Collections.unmodifiableMap(errors)).build());
    }

    /** Most recent agent turn that carried tool outputs. */
    private static Optional<ToolOutputs> latestOutputs(List<ConversationTurn> history) {
        for (int i = history.size() - 1; i >= 0; i--) {
            ToolOutputs outputs = history.get(i).getToolOutputs();
            if (outputs != null && !outputs.isEmpty()) {
                return Optional.of(outputs);
            }
        }
        return Optional.empty();
    }

    private static String truncate(String text, int maxLength) {
        return text.length() > maxLength ? text.substring(0, maxLength) + "..." : text;
    }

    private record ExecutionOutcome(List<String> toolsUsed, ToolOutputs outputs) {
    }
}
