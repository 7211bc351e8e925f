package com.casepilot.core.state;

import com.casepilot.llm.ToolInvocation;

/**
 * One entry of a conversation. Assistant turns may carry the tool the model asked for;
 * tool-result turns reference that request by id.
 */
public final class ConversationTurn {

    private final TurnRole role;
    private final String content;
    private final ToolInvocation toolInvocation;  // ASSISTANT only, may be null
    private final String toolUseId;               // TOOL_RESULT only
    private final boolean error;                  // TOOL_RESULT only

    private ConversationTurn(TurnRole role, String content, ToolInvocation toolInvocation,
                             String toolUseId, boolean error) {
        this.role = role;
        this.content = content != null ? content : "";
        this.toolInvocation = toolInvocation;
        this.toolUseId = toolUseId;
        this.error = error;
    }

    public static ConversationTurn user(String content) {
        return new ConversationTurn(TurnRole.USER, content, null, null, false);
    }

    public static ConversationTurn assistant(String text, ToolInvocation invocation) {
        return new ConversationTurn(TurnRole.ASSISTANT, text, invocation, null, false);
    }

    public static ConversationTurn toolResult(String toolUseId, String content, boolean error) {
        return new ConversationTurn(TurnRole.TOOL_RESULT, content, null, toolUseId, error);
    }

    public TurnRole getRole() {
        return role;
    }

    public String getContent() {
        return content;
    }

    public ToolInvocation getToolInvocation() {
        return toolInvocation;
    }

    public String getToolUseId() {
        return toolUseId;
    }

    public boolean isError() {
        return error;
    }
}
