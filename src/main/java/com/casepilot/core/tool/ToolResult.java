package com.casepilot.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Result envelope returned by a tool collaborator: a JSON payload, or an error message.
 */
public class ToolResult {

    private final JsonNode payload;
    private final String error;

    private ToolResult(JsonNode payload, String error) {
        this.payload = payload != null ? payload : JsonNodeFactory.instance.objectNode();
        this.error = error;
    }

    public static ToolResult ok(JsonNode payload) {
        return new ToolResult(payload, null);
    }

    /**
     * Create an error ToolResult.
     * Used when a tool cannot be executed or reports a failure.
     */
    public static ToolResult error(String errorMessage) {
        return new ToolResult(null, errorMessage != null ? errorMessage : "unknown error");
    }

    public JsonNode getPayload() {
        return payload;
    }

    public String getError() {
        return error;
    }

    public boolean isError() {
        return error != null;
    }

    @Override
    public String toString() {
        return isError()
                ? "ToolResult{error='" + error + "'}"
                : "ToolResult{fields=" + payload.size() + "}";
    }
}
