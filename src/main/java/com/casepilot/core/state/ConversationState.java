package com.casepilot.core.state;

import com.casepilot.llm.ToolInvocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered conversation of one investigation: system instructions plus turns.
 *
 * Owned by exactly one orchestrator invocation and never shared, so it is not
 * synchronized.
 */
public class ConversationState {

    private final String systemPrompt;
    private final List<ConversationTurn> turns = new ArrayList<>();

    public ConversationState(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public void addUserMessage(String content) {
        turns.add(ConversationTurn.user(content));
    }

    public void addAssistantTurn(String text, ToolInvocation invocation) {
        turns.add(ConversationTurn.assistant(text, invocation));
    }

    public void addToolResult(String toolUseId, String content, boolean error) {
        turns.add(ConversationTurn.toolResult(toolUseId, content, error));
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public List<ConversationTurn> getTurns() {
        return Collections.unmodifiableList(turns);
    }

    public int size() {
        return turns.size();
    }

    public long countToolResults() {
        return turns.stream().filter(t -> t.getRole() == TurnRole.TOOL_RESULT).count();
    }
}
