package com.casepilot.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.web.client.RestTemplate;

import com.casepilot.core.tool.RemoteToolCollaborator;
import com.casepilot.core.tool.ToolBindings;
import com.casepilot.core.tool.ToolCatalog;
import com.casepilot.core.tool.ToolCatalogEntry;
import com.casepilot.core.tool.ToolCollaborator;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds every declared tool to the HTTP tool server.
 */
@Configuration
@Profile("!mock")
public class RemoteToolConfig {

    private static final Logger log = LoggerFactory.getLogger(RemoteToolConfig.class);

    @Bean
    public ToolBindings toolBindings(ToolCatalog catalog,
                                     RestTemplate restTemplate,
                                     ObjectMapper objectMapper,
                                     @Value("${casepilot.tools.base-url:http://localhost:8001}") String baseUrl) {
        Map<String, ToolCollaborator> collaborators = new LinkedHashMap<>();
        for (ToolCatalogEntry entry : catalog.entries()) {
            collaborators.put(entry.getName(),
                    new RemoteToolCollaborator(entry.getName(), baseUrl, restTemplate, objectMapper));
        }
        log.info("[Config] Remote tool bindings: {} tool(s) at {}", collaborators.size(), baseUrl);
        return new ToolBindings(collaborators);
    }
}
