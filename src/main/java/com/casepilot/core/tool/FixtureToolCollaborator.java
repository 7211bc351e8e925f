package com.casepilot.core.tool;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Serves canned responses for one tool, keyed by one argument (customer_id, account_id, ...).
 *
 * Fixture shape: {"key": "customer_id", "responses": {"C-1001": {...}}, "default": {...}}.
 * A response carrying an "error" field is returned as an error result.
 */
public class FixtureToolCollaborator implements ToolCollaborator {

    private final String toolName;
    private final String keyField;
    private final JsonNode responses;
    private final JsonNode defaultResponse;

    public FixtureToolCollaborator(String toolName, JsonNode fixture) {
        this.toolName = toolName;
        this.keyField = fixture.path("key").asText(null);
        this.responses = fixture.path("responses");
        this.defaultResponse = fixture.get("default");
    }

    @Override
    public ToolResult invoke(JsonNode args) {
        JsonNode response = null;
        String keyValue = null;
        if (keyField != null) {
            keyValue = args.path(keyField).asText("");
            response = responses.get(keyValue);
        }
        if (response == null) {
            response = defaultResponse;
        }
        if (response == null) {
            return ToolResult.error(toolName + ": no record for " + keyField + "=" + keyValue);
        }
        if (response.has("error")) {
            return ToolResult.error(response.get("error").asText());
        }
        return ToolResult.ok(response.deepCopy());
    }
}
