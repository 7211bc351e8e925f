package com.casepilot.llm;

import com.casepilot.core.agent.AgentType;
import com.casepilot.core.state.ConversationState;
import com.casepilot.core.tool.ToolDefinition;

import java.util.List;

/**
 * LLMClient - the completion capability.
 *
 * Two call shapes:
 *   complete(...)         - one investigator turn over the whole conversation, tools offered
 *   generateWithRole(...) - a single non-tool prompt (critic review, paraphrasing)
 *
 * Implementations throw CompletionCapabilityException on any transport or provider failure;
 * callers treat that as an ordinary model failure.
 */
public interface LLMClient {

    /**
     * Requests the next action of the investigation.
     *
     * @param conversation system prompt and turns so far
     * @param tools        declared tools plus the terminal tool
     * @return the reply; carries at most one tool invocation
     */
    ModelReply complete(ConversationState conversation, List<ToolDefinition> tools);

    /**
     * @return raw response text. Never null; empty string on empty model output.
     */
    String generateWithRole(AgentType role, String userPrompt, double temperature);

    /**
     * Canonical per-role sampling temperatures.
     *
     * INVESTIGATOR 0.2 - tool selection; low variance
     * CRITIC       0.0 - yes/no judgement
     * PARAPHRASER  0.7 - wording must actually vary
     */
    default double getTemperatureForRole(AgentType role) {
        return switch (role) {
            case INVESTIGATOR -> 0.2;
            case CRITIC       -> 0.0;
            case PARAPHRASER  -> 0.7;
        };
    }

    /** Model identifier recorded on traces and critic verdicts. */
    default String modelFor(AgentType role) {
        return "unknown";
    }
}
