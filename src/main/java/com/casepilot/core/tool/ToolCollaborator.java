package com.casepilot.core.tool;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One concrete tool behind a declared name (database read, vector search, ...).
 *
 * Implementations may either return {@link ToolResult#error(String)} or throw;
 * the dispatcher treats both as a tool-level failure.
 */
public interface ToolCollaborator {

    ToolResult invoke(JsonNode args) throws Exception;
}
