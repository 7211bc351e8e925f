package com.casepilot.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * A tool call requested by the model: provider-assigned id, tool name, JSON arguments.
 */
public class ToolInvocation {

    private final String id;
    private final String name;
    private final JsonNode args;

    public ToolInvocation(String id, String name, JsonNode args) {
        this.id = id;
        this.name = name;
        this.args = args != null ? args : JsonNodeFactory.instance.objectNode();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public JsonNode getArgs() {
        return args;
    }

    @Override
    public String toString() {
        return "ToolInvocation{id='" + id + "', name='" + name + "'}";
    }
}
