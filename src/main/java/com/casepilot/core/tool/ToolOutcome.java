package com.casepilot.core.tool;

/**
 * What the dispatcher hands back to the loop: the audit record plus the text that is
 * appended to the conversation as the tool's result.
 */
public final class ToolOutcome {

    private final ToolCallRecord record;
    private final String content;

    public ToolOutcome(ToolCallRecord record, String content) {
        this.record = record;
        this.content = content != null ? content : "{}";
    }

    public ToolCallRecord getRecord() {
        return record;
    }

    public String getContent() {
        return content;
    }
}
