package com.example.infracopilot.agent;

import com.example.infracopilot.domain.ToolOutputs;
import com.example.infracopilot.session.ConversationTurn;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything the narrative service receives to compose a final answer.
 */
@Value
@Builder
public class NarrativeRequest {

    String input;
    AgentMode mode;
    List<ConversationTurn> history;
    List<String> toolsUsed;
    String reasoning;
    /** Outputs of this turn's tools, or of an earlier turn when none ran. */
    ToolOutputs outputs;
    /** True when {@link #outputs} were carried over from the session history. */
    boolean outputsFromHistory;
}
