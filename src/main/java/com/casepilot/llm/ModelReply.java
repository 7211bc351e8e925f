package com.casepilot.llm;

/**
 * One completion response: free text the model emitted, at most one tool invocation,
 * and the token usage of the call.
 */
public class ModelReply {

    private final String text;
    private final ToolInvocation toolInvocation;
    private final int inputTokens;
    private final int outputTokens;

    public ModelReply(String text, ToolInvocation toolInvocation, int inputTokens, int outputTokens) {
        this.text = text != null ? text : "";
        this.toolInvocation = toolInvocation;
        this.inputTokens = inputTokens;
        this.outputTokens = outputTokens;
    }

    public static ModelReply toolCall(String text, ToolInvocation invocation) {
        return new ModelReply(text, invocation, 0, 0);
    }

    public static ModelReply text(String text) {
        return new ModelReply(text, null, 0, 0);
    }

    public String getText() {
        return text;
    }

    public ToolInvocation getToolInvocation() {
        return toolInvocation;
    }

    public boolean hasToolInvocation() {
        return toolInvocation != null;
    }

    public int getInputTokens() {
        return inputTokens;
    }

    public int getOutputTokens() {
        return outputTokens;
    }
}
