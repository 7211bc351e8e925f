package com.casepilot.core.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Tool name → collaborator, assembled once per process by the active profile's configuration.
 */
public class ToolBindings {

    private final Map<String, ToolCollaborator> collaborators;

    public ToolBindings(Map<String, ToolCollaborator> collaborators) {
        this.collaborators = Collections.unmodifiableMap(new LinkedHashMap<>(collaborators));
    }

    public Optional<ToolCollaborator> forTool(String toolName) {
        return Optional.ofNullable(collaborators.get(toolName));
    }

    public int size() {
        return collaborators.size();
    }
}
