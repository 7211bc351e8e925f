package com.casepilot.core.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Invokes one tool on the tool server: POST {baseUrl}/tools/{name} with the arguments
 * as the JSON body. A response object with an "error" field is an error result.
 */
public class RemoteToolCollaborator implements ToolCollaborator {

    private static final Logger log = LoggerFactory.getLogger(RemoteToolCollaborator.class);

    private final String toolName;
    private final String url;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public RemoteToolCollaborator(String toolName, String baseUrl, RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.toolName = toolName;
        this.url = baseUrl.replaceAll("/+$", "") + "/tools/" + toolName;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolResult invoke(JsonNode args) throws Exception {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(url,
                    new HttpEntity<>(objectMapper.writeValueAsString(args), headers), String.class);
        } catch (RestClientException e) {
            log.warn("[RemoteTool] {} call failed: {}", toolName, e.getMessage());
            return ToolResult.error(toolName + " unavailable: " + e.getMessage());
        }

        String body = response.getBody();
        if (body == null || body.isBlank()) {
            return ToolResult.ok(objectMapper.createObjectNode());
        }
        JsonNode payload = objectMapper.readTree(body);
        if (payload.has("error")) {
            return ToolResult.error(payload.get("error").asText());
        }
        return ToolResult.ok(payload);
    }
}
