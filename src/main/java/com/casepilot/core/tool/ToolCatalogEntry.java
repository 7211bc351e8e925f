package com.casepilot.core.tool;

import com.fasterxml.jackson.databind.JsonNode;

public class ToolCatalogEntry {

    private final String name;
    private final String description;
    private final JsonNode inputSchema;
    private final ToolClass toolClass;
    private final boolean recoverable;

    public ToolCatalogEntry(String name,
                            String description,
                            JsonNode inputSchema,
                            ToolClass toolClass,
                            boolean recoverable) {
        this.name = name;
        this.description = description;
        this.inputSchema = inputSchema;
        this.toolClass = toolClass != null ? toolClass : ToolClass.LOOKUP;
        this.recoverable = recoverable;
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

    public ToolClass getToolClass() {
        return toolClass;
    }

    /** False means a collaborator error aborts the whole investigation. */
    public boolean isRecoverable() {
        return recoverable;
    }

    public ToolDefinition toDefinition() {
        return new ToolDefinition(name, description, inputSchema);
    }

    @Override
    public String toString() {
        return "ToolCatalogEntry{name='" + name + "', class=" + toolClass + ", recoverable=" + recoverable + "}";
    }
}
