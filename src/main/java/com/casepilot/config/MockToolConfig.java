package com.casepilot.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import com.casepilot.core.tool.FixtureToolCollaborator;
import com.casepilot.core.tool.ToolBindings;
import com.casepilot.core.tool.ToolCatalog;
import com.casepilot.core.tool.ToolCatalogEntry;
import com.casepilot.core.tool.ToolCollaborator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds every declared tool to classpath fixtures for local runs without a tool server.
 */
@Configuration
@Profile("mock")
public class MockToolConfig {

    private static final Logger log = LoggerFactory.getLogger(MockToolConfig.class);

    static final String TOOL_FIXTURES_RESOURCE = "fixtures/tool-fixtures.json";

    @Bean
    public ToolBindings toolBindings(ToolCatalog catalog, ObjectMapper objectMapper) {
        JsonNode fixtures = readFixtures(objectMapper);

        Map<String, ToolCollaborator> collaborators = new LinkedHashMap<>();
        for (ToolCatalogEntry entry : catalog.entries()) {
            JsonNode fixture = fixtures.get(entry.getName());
            if (fixture == null) {
                log.warn("[Config] No fixture for tool {}; it will report an error when called", entry.getName());
                fixture = objectMapper.createObjectNode();
            }
            collaborators.put(entry.getName(), new FixtureToolCollaborator(entry.getName(), fixture));
        }
        log.info("[Config] Fixture tool bindings: {}", collaborators.keySet());
        return new ToolBindings(collaborators);
    }

    private static JsonNode readFixtures(ObjectMapper objectMapper) {
        try (InputStream in = MockToolConfig.class.getClassLoader().getResourceAsStream(TOOL_FIXTURES_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + TOOL_FIXTURES_RESOURCE);
            }
            return objectMapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + TOOL_FIXTURES_RESOURCE, e);
        }
    }
}
