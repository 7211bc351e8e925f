package com.casepilot.core.tool;

import com.casepilot.core.terminal.TerminalInterceptor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The declared, dispatchable tools of this process. Built once and passed in explicitly;
 * the reserved terminal tool can never be part of it.
 */
public class ToolCatalog {

    private final Map<String, ToolCatalogEntry> entries;

    public ToolCatalog(Collection<ToolCatalogEntry> entries) {
        Map<String, ToolCatalogEntry> byName = new LinkedHashMap<>();
        for (ToolCatalogEntry entry : entries) {
            if (TerminalInterceptor.TERMINAL_TOOL_NAME.equals(entry.getName())) {
                throw new IllegalArgumentException(
                        "Terminal tool '" + entry.getName() + "' cannot be declared in the tool catalog");
            }
            if (byName.putIfAbsent(entry.getName(), entry) != null) {
                throw new IllegalArgumentException("Duplicate tool declaration: " + entry.getName());
            }
        }
        this.entries = Collections.unmodifiableMap(byName);
    }

    /**
     * Reads a catalog document: {"tools": [{name, description, tool_class, recoverable, input_schema}]}.
     */
    public static ToolCatalog fromJson(ObjectMapper mapper, InputStream in) throws IOException {
        JsonNode root = mapper.readTree(in);
        JsonNode tools = root.path("tools");
        if (!tools.isArray()) {
            throw new IOException("Tool catalog document has no 'tools' array");
        }

        List<ToolCatalogEntry> entries = new ArrayList<>();
        for (JsonNode tool : tools) {
            String name = tool.path("name").asText("");
            if (name.isBlank()) {
                throw new IOException("Tool catalog entry without a name: " + tool);
            }
            entries.add(new ToolCatalogEntry(
                    name,
                    tool.path("description").asText(""),
                    tool.has("input_schema") ? tool.get("input_schema") : mapper.createObjectNode().put("type", "object"),
                    ToolClass.valueOf(tool.path("tool_class").asText("LOOKUP").toUpperCase()),
                    tool.path("recoverable").asBoolean(true)
            ));
        }
        return new ToolCatalog(entries);
    }

    public Optional<ToolCatalogEntry> find(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    public Collection<ToolCatalogEntry> entries() {
        return entries.values();
    }

    public List<ToolDefinition> definitions() {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (ToolCatalogEntry entry : entries.values()) {
            definitions.add(entry.toDefinition());
        }
        return definitions;
    }

    public int size() {
        return entries.size();
    }
}
