package com.example.infracopilot.agent;

import com.example.infracopilot.domain.ReportContext;
import com.example.infracopilot.session.ConversationTurn;

import java.util.List;

/**
 * The language capability the agent depends on. Every method may throw
 * {@link NarrativeServiceException}; that is the only failure that aborts a
 * turn.
 */
public interface NarrativeService {

    /**
     * Decides which tools to run for free-form input. Unparseable model output
     * yields an empty decision rather than an error.
     */
    ToolDecision selectTools(List<ConversationTurn> history, String input, List<AgentTool> tools);

    /** Markdown report for a compiled context. */
    String writeReport(ReportContext report);

    /** Final answer for a turn. */
    String answer(NarrativeRequest request);

    String getModelId();
}
