package com.example.infracopilot.agent;

import com.example.infracopilot.config.CopilotProperties;
import com.example.infracopilot.domain.ReportContext;
import com.example.infracopilot.session.ConversationTurn;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link NarrativeService} backed by the configured language model.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LlmNarrativeService implements NarrativeService {

    private static final double ROUTER_TEMPERATURE = 0.0;
    private static final int ROUTER_MAX_TOKENS = 300;

    private final LlmClient llmClient;
    private final PromptBuilder promptBuilder;
    private final ToolDecisionParser decisionParser;
    private final CopilotProperties properties;

    @Override
    public ToolDecision selectTools(List<ConversationTurn> history, String input, List<AgentTool> tools) {
        List<AgentMessage> messages = new ArrayList<>();
        messages.add(AgentMessage.system(promptBuilder.buildRouterPrompt(tools)));
        messages.addAll(promptBuilder.buildHistory(history));
        messages.add(AgentMessage.user(input));

        AgentMessage reply = llmClient.chat(messages, tools, ROUTER_TEMPERATURE, ROUTER_MAX_TOKENS);
        ToolDecision decision = decisionParser.parse(reply);
        log.debug("Tool selection: {} ({})", decision.toolNames(), decision.reasoning());
        return decision;
    }

    @Override
    public String writeReport(ReportContext report) {
        List<AgentMessage> messages = List.of(
                AgentMessage.system(promptBuilder.buildReportPrompt(report.getFraming())),
                AgentMessage.user(promptBuilder.buildReportInput(report)));
        return requireText(complete(messages), "report");
    }

    @Override
    public String answer(NarrativeRequest request) {
        boolean hasOutputs = request.getOutputs() != null && !request.getOutputs().isEmpty();
        List<AgentMessage> messages = new ArrayList<>();
        messages.add(AgentMessage.system(promptBuilder.buildAnswerPrompt(hasOutputs)));
        messages.addAll(promptBuilder.buildHistory(request.getHistory()));
        messages.add(AgentMessage.user(promptBuilder.buildAnswerInput(request)));
        return requireText(complete(messages), "answer");
    }

    @Override
    public String getModelId() {
        return llmClient.getModelId();
    }

    private AgentMessage complete(List<AgentMessage> messages) {
        CopilotProperties.LlmConfig llm = properties.getLlm();
        return llmClient.chat(messages, List.of(), llm.getTemperature(), llm.getMaxTokens());
    }

    private static String requireText(AgentMessage reply, String what) {
        String text = reply.getContent();
        if (text == null || text.isBlank()) {
            throw new NarrativeServiceException("LLM returned an empty " + what);
        }
        return text.trim();
    }
}
