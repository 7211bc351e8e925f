package com.casepilot.llm;

import com.casepilot.core.agent.AgentType;
import com.casepilot.core.error.CompletionCapabilityException;
import com.casepilot.core.state.ConversationState;
import com.casepilot.core.state.ConversationTurn;
import com.casepilot.core.tool.ToolDefinition;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * AnthropicLLMClient - production LLMClient over the Anthropic Messages API.
 *
 * Tool use is requested with parallel tool calls disabled, so a reply carries at most one
 * tool_use block. Role system prompts for non-tool calls live here; the investigator's
 * system prompt arrives with the conversation.
 */
@Component
@Profile("!mock")
public class AnthropicLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicLLMClient.class);

    private static final String API_VERSION = "2023-06-01";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final String investigatorModel;
    private final String criticModel;
    private final String paraphraserModel;
    private final int maxTokens;

    public AnthropicLLMClient(RestTemplate restTemplate,
                              ObjectMapper objectMapper,
                              @Value("${casepilot.anthropic.base-url:https://api.anthropic.com}") String baseUrl,
                              @Value("${casepilot.anthropic.api-key:}") String apiKey,
                              @Value("${casepilot.anthropic.model.investigator:claude-sonnet-4-5}") String investigatorModel,
                              @Value("${casepilot.anthropic.model.critic:claude-haiku-4-5}") String criticModel,
                              @Value("${casepilot.anthropic.model.paraphraser:claude-haiku-4-5}") String paraphraserModel,
                              @Value("${casepilot.anthropic.max-tokens:2048}") int maxTokens) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.apiKey = apiKey;
        this.investigatorModel = investigatorModel;
        this.criticModel = criticModel;
        this.paraphraserModel = paraphraserModel;
        this.maxTokens = maxTokens;

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[Anthropic] No API key configured (casepilot.anthropic.api-key); completions will fail");
        }
    }

    // =========================================================================
    // LLMClient contract
    // =========================================================================

    @Override
    public ModelReply complete(ConversationState conversation, List<ToolDefinition> tools) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", investigatorModel);
        payload.put("max_tokens", maxTokens);
        payload.put("temperature", getTemperatureForRole(AgentType.INVESTIGATOR));
        payload.put("system", conversation.getSystemPrompt());

        ArrayNode toolArray = payload.putArray("tools");
        for (ToolDefinition tool : tools) {
            ObjectNode t = toolArray.addObject();
            t.put("name", tool.getName());
            t.put("description", tool.getDescription());
            t.set("input_schema", tool.getInputSchema());
        }
        ObjectNode toolChoice = payload.putObject("tool_choice");
        toolChoice.put("type", "auto");
        toolChoice.put("disable_parallel_tool_use", true);

        ArrayNode messages = payload.putArray("messages");
        for (ConversationTurn turn : conversation.getTurns()) {
            messages.add(toMessage(turn));
        }

        log.debug("[Anthropic] complete model={} turns={} tools={}",
                investigatorModel, conversation.size(), tools.size());

        JsonNode response = post(payload);
        return toModelReply(response);
    }

    @Override
    public String generateWithRole(AgentType role, String userPrompt, double temperature) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", modelFor(role));
        payload.put("max_tokens", maxTokens);
        payload.put("temperature", temperature);
        payload.put("system", getSystemPromptForRole(role));

        ObjectNode message = payload.putArray("messages").addObject();
        message.put("role", "user");
        message.put("content", userPrompt);

        log.debug("[Anthropic] role={} temperature={} promptLen={}", role, temperature, userPrompt.length());

        ModelReply reply = toModelReply(post(payload));
        return reply.getText();
    }

    @Override
    public String modelFor(AgentType role) {
        return switch (role) {
            case INVESTIGATOR -> investigatorModel;
            case CRITIC       -> criticModel;
            case PARAPHRASER  -> paraphraserModel;
        };
    }

    // =========================================================================
    // System prompts for non-tool roles
    // =========================================================================

    private String getSystemPromptForRole(AgentType role) {
        return switch (role) {
            case CRITIC -> """
                    You are a senior reviewer auditing a customer-support investigation at a brokerage.
                    Judge whether the verdict follows from the evidence. Do not re-investigate.
                    Respond ONLY with JSON: {"agrees": true|false, "note": "<one sentence>"}.
                    """;

            case PARAPHRASER -> """
                    You rewrite customer messages. Keep every fact, amount, date, account detail
                    and identifier exactly as given. Change only wording and sentence structure.
                    Output only the rewritten message.
                    """;

            default -> "You are a precise financial support investigator. Be concise.";
        };
    }

    // =========================================================================
    // Wire mapping
    // =========================================================================

    private ObjectNode toMessage(ConversationTurn turn) {
        ObjectNode message = objectMapper.createObjectNode();
        switch (turn.getRole()) {
            case USER -> {
                message.put("role", "user");
                message.put("content", turn.getContent());
            }
            case ASSISTANT -> {
                message.put("role", "assistant");
                ArrayNode content = message.putArray("content");
                if (!turn.getContent().isBlank()) {
                    content.addObject().put("type", "text").put("text", turn.getContent());
                }
                ToolInvocation invocation = turn.getToolInvocation();
                if (invocation != null) {
                    ObjectNode block = content.addObject();
                    block.put("type", "tool_use");
                    block.put("id", invocation.getId());
                    block.put("name", invocation.getName());
                    block.set("input", invocation.getArgs());
                }
                if (content.isEmpty()) {
                    content.addObject().put("type", "text").put("text", "(no content)");
                }
            }
            case TOOL_RESULT -> {
                message.put("role", "user");
                ObjectNode block = message.putArray("content").addObject();
                block.put("type", "tool_result");
                block.put("tool_use_id", turn.getToolUseId());
                block.put("content", turn.getContent());
                if (turn.isError()) {
                    block.put("is_error", true);
                }
            }
        }
        return message;
    }

    private ModelReply toModelReply(JsonNode response) {
        StringBuilder text = new StringBuilder();
        ToolInvocation invocation = null;

        for (JsonNode block : response.path("content")) {
            String type = block.path("type").asText();
            if ("text".equals(type)) {
                if (text.length() > 0) text.append('\n');
                text.append(block.path("text").asText());
            } else if ("tool_use".equals(type) && invocation == null) {
                invocation = new ToolInvocation(
                        block.path("id").asText(),
                        block.path("name").asText(),
                        block.path("input"));
            }
        }

        JsonNode usage = response.path("usage");
        return new ModelReply(text.toString(), invocation,
                usage.path("input_tokens").asInt(0),
                usage.path("output_tokens").asInt(0));
    }

    // =========================================================================
    // HTTP
    // =========================================================================

    private JsonNode post(ObjectNode payload) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("x-api-key", apiKey);
        headers.set("anthropic-version", API_VERSION);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    baseUrl + "/v1/messages",
                    new HttpEntity<>(objectMapper.writeValueAsString(payload), headers),
                    String.class);

            JsonNode root = objectMapper.readTree(response.getBody());
            if ("error".equals(root.path("type").asText())) {
                throw new CompletionCapabilityException(
                        "Anthropic error: " + root.path("error").path("message").asText());
            }
            return root;

        } catch (CompletionCapabilityException e) {
            throw e;
        } catch (RestClientException e) {
            log.error("[Anthropic] Call failed: {}", e.getMessage());
            throw new CompletionCapabilityException("Anthropic call failed: " + e.getMessage(), e);
        } catch (Exception e) {
            log.error("[Anthropic] Unreadable response: {}", e.getMessage());
            throw new CompletionCapabilityException("Anthropic response unreadable: " + e.getMessage(), e);
        }
    }

    private static String stripTrailingSlash(String url) {
        String result = url == null ? "" : url.trim();
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
