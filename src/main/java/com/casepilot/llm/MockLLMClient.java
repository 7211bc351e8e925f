package com.casepilot.llm;

import com.casepilot.core.agent.AgentType;
import com.casepilot.core.state.ConversationState;
import com.casepilot.core.state.ConversationTurn;
import com.casepilot.core.state.TurnRole;
import com.casepilot.core.terminal.TerminalInterceptor;
import com.casepilot.core.tool.ToolDefinition;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scripted investigator for local runs. The script is chosen from keywords in the
 * issue context; each assistant turn so far advances one step.
 */
@Component
@Profile("mock")
public class MockLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(MockLLMClient.class);

    public static final String MODEL = "mock-scripted";

    private static final Pattern CUSTOMER_ID = Pattern.compile("Customer ID:\\s*(\\S+)");
    private static final Pattern QUOTED_MESSAGE = Pattern.compile("<<<\\s*(.*?)\\s*>>>", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public MockLLMClient(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ModelReply complete(ConversationState conversation, List<ToolDefinition> tools) {
        String context = firstUserMessage(conversation);
        String customerId = matchOr(CUSTOMER_ID, context, "UNKNOWN");
        int step = (int) conversation.getTurns().stream()
                .filter(t -> t.getRole() == TurnRole.ASSISTANT)
                .count();

        ScriptContext ctx = new ScriptContext(customerId, lastAccountId(conversation, customerId));
        List<Function<ScriptContext, ModelReply>> script = scriptFor(context.toLowerCase(Locale.ROOT));
        ModelReply reply = script.get(Math.min(step, script.size() - 1)).apply(ctx);

        log.debug("[MockLLM] step={} tool={}", step,
                reply.hasToolInvocation() ? reply.getToolInvocation().getName() : "-");
        return new ModelReply(reply.getText(), reply.getToolInvocation(),
                estimateTokens(conversation), estimateTokens(reply.getText()));
    }

    @Override
    public String generateWithRole(AgentType role, String userPrompt, double temperature) {
        return switch (role) {
            case CRITIC -> """
                    {"agrees": true, "note": "Verdict is consistent with the evidence gathered."}
                    """;
            case PARAPHRASER -> {
                String original = matchOr(QUOTED_MESSAGE, userPrompt, userPrompt);
                yield "Hello, following up on this. " + original;
            }
            case INVESTIGATOR -> "";
        };
    }

    @Override
    public String modelFor(AgentType role) {
        return MODEL;
    }

    // =========================================================================
    // Scripts
    // =========================================================================

    private List<Function<ScriptContext, ModelReply>> scriptFor(String context) {
        if (context.contains("wire")) {
            return List.of(
                    c -> tool("Looking up the customer first.", "customer_lookup", args().put("customer_id", c.customerId)),
                    c -> tool("Checking the receiving account.", "account_lookup", args().put("customer_id", c.customerId)),
                    c -> tool("Searching for the inbound wire.", "transactions_search",
                            args().put("account_id", c.accountId).put("transaction_type", "wire_in").put("days", 7)),
                    c -> tool("Checking policy on review holds.", "policy_search",
                            args().put("query", "inbound wire held for AML review")),
                    c -> terminal("The wire is held by a routine AML review; no action beyond explaining it.",
                            args().put("issue_type", "WIRE_TRANSFER_DELAY")
                                    .put("root_cause", "Inbound wire of $15,000 is held pending AML review on the receiving account.")
                                    .put("resolution", "Explained the review hold and the expected release window to the customer.")
                                    .put("resolution_type", "AUTO_RESOLVED")
                                    .put("confidence_score", 0.88)
                                    .put("escalate", false)
                                    .set("policy_flags", objectMapper.createArrayNode().add("AML_REVIEW_TRIGGERED"))));
        }
        if (context.contains("didn't place") || context.contains("did not place")
                || context.contains("unauthorized") || context.contains("sell order")) {
            return List.of(
                    c -> tool("Looking up the customer.", "customer_lookup", args().put("customer_id", c.customerId)),
                    c -> tool("Checking recent logins.", "account_login_history", args().put("customer_id", c.customerId)),
                    c -> tool("Finding the trading account.", "account_lookup", args().put("customer_id", c.customerId)),
                    c -> tool("Finding the disputed order.", "transactions_search",
                            args().put("account_id", c.accountId).put("transaction_type", "trade_sell").put("days", 2)),
                    c -> terminal("The order looks settled; closing it out.",
                            args().put("issue_type", "UNAUTHORIZED_TRADE")
                                    .put("root_cause", "Sell order of $8,400 placed 90 minutes after a login from an unrecognized country.")
                                    .put("resolution", "Order confirmed as executed.")
                                    .put("resolution_type", "AUTO_RESOLVED")
                                    .put("confidence_score", 0.93)
                                    .put("escalate", false)));
        }
        return List.of(
                c -> tool("Looking up the customer.", "customer_lookup", args().put("customer_id", c.customerId)),
                c -> tool("Checking the accounts.", "account_lookup", args().put("customer_id", c.customerId)),
                c -> terminal("Answered the customer's question from account data.",
                        args().put("issue_type", "GENERAL_INQUIRY")
                                .put("root_cause", "Customer question answered from account records.")
                                .put("resolution", "Provided the requested account information.")
                                .put("resolution_type", "AUTO_RESOLVED")
                                .put("confidence_score", 0.82)
                                .put("escalate", false)));
    }

    private static final class ScriptContext {
        private final String customerId;
        private final String accountId;

        private ScriptContext(String customerId, String accountId) {
            this.customerId = customerId;
            this.accountId = accountId;
        }
    }

    private ModelReply tool(String text, String name, JsonNode args) {
        return ModelReply.toolCall(text, new ToolInvocation(toolUseId(), name, args));
    }

    private ModelReply terminal(String text, JsonNode args) {
        return ModelReply.toolCall(text,
                new ToolInvocation(toolUseId(), TerminalInterceptor.TERMINAL_TOOL_NAME, args));
    }

    private ObjectNode args() {
        return objectMapper.createObjectNode();
    }

    private static String toolUseId() {
        return "toolu_mock_" + Long.toHexString(System.nanoTime());
    }

    private static String firstUserMessage(ConversationState conversation) {
        return conversation.getTurns().stream()
                .filter(t -> t.getRole() == TurnRole.USER)
                .map(ConversationTurn::getContent)
                .findFirst()
                .orElse("");
    }

    private static String matchOr(Pattern pattern, String text, String fallback) {
        Matcher m = pattern.matcher(text);
        return m.find() ? m.group(1) : fallback;
    }

    // first account id from the most recent account_lookup result
    private String lastAccountId(ConversationState conversation, String fallback) {
        List<ConversationTurn> turns = conversation.getTurns();
        for (int i = turns.size() - 1; i >= 0; i--) {
            ConversationTurn turn = turns.get(i);
            if (turn.getRole() != TurnRole.TOOL_RESULT || turn.isError()) {
                continue;
            }
            try {
                JsonNode accounts = objectMapper.readTree(turn.getContent()).path("accounts");
                if (accounts.isArray() && accounts.size() > 0) {
                    return accounts.get(0).path("account_id").asText(fallback);
                }
            } catch (Exception e) {
                log.debug("[MockLLM] Tool result is not JSON: {}", e.getMessage());
            }
        }
        return fallback;
    }

    private static int estimateTokens(ConversationState conversation) {
        int chars = conversation.getSystemPrompt().length();
        for (ConversationTurn turn : conversation.getTurns()) {
            chars += turn.getContent().length();
        }
        return chars / 4;
    }

    private static int estimateTokens(String text) {
        return text.length() / 4;
    }
}
