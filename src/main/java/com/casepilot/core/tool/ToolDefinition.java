package com.casepilot.core.tool;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * What the completion capability sees of a tool: name, description, input schema.
 */
public class ToolDefinition {

    private final String name;
    private final String description;
    private final JsonNode inputSchema;

    public ToolDefinition(String name, String description, JsonNode inputSchema) {
        this.name = name;
        this.description = description != null ? description : "";
        this.inputSchema = inputSchema;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public JsonNode getInputSchema() {
        return inputSchema;
    }
}
