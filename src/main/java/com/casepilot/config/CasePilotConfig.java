package com.casepilot.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import com.casepilot.core.tool.ToolCatalog;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;

/**
 * Process-wide beans shared by every profile.
 */
@Configuration
public class CasePilotConfig {

    private static final Logger log = LoggerFactory.getLogger(CasePilotConfig.class);

    static final String TOOL_CATALOG_RESOURCE = "tool-catalog.json";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * The declared tools, read once. The terminal tool is rejected here if anyone
     * adds it to the resource.
     */
    @Bean
    public ToolCatalog toolCatalog(ObjectMapper objectMapper) {
        try (InputStream in = CasePilotConfig.class.getClassLoader().getResourceAsStream(TOOL_CATALOG_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + TOOL_CATALOG_RESOURCE);
            }
            ToolCatalog catalog = ToolCatalog.fromJson(objectMapper, in);
            log.info("[Config] Tool catalog loaded: {} tool(s)", catalog.size());
            return catalog;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + TOOL_CATALOG_RESOURCE, e);
        }
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder,
                                     @Value("${casepilot.http.connect-timeout:5s}") Duration connectTimeout,
                                     @Value("${casepilot.http.read-timeout:55s}")   Duration readTimeout) {
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }
}
