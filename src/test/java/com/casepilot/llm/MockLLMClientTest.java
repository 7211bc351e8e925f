package com.casepilot.llm;

import com.casepilot.core.agent.AgentType;
import com.casepilot.core.state.ConversationState;
import com.casepilot.core.terminal.TerminalInterceptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MockLLMClientTest {

    private final MockLLMClient client = new MockLLMClient(new ObjectMapper());

    @Test
    void testWireScriptUsesAccountFromLookup() {
        ConversationState conversation = conversation("C-1001", "My wire has not arrived.");

        ModelReply first = client.complete(conversation, List.of());
        assertEquals("customer_lookup", first.getToolInvocation().getName());
        assertEquals("C-1001", first.getToolInvocation().getArgs().path("customer_id").asText());

        advance(conversation, first, "{\"customer_id\": \"C-1001\"}");
        ModelReply second = client.complete(conversation, List.of());
        assertEquals("account_lookup", second.getToolInvocation().getName());

        advance(conversation, second, "{\"count\": 1, \"accounts\": [{\"account_id\": \"A-1001-CASH\"}]}");
        ModelReply third = client.complete(conversation, List.of());
        assertEquals("transactions_search", third.getToolInvocation().getName());
        assertEquals("A-1001-CASH", third.getToolInvocation().getArgs().path("account_id").asText());
        assertTrue(third.getInputTokens() > 0);
    }

    @Test
    void testScriptEndsWithTerminalTool() {
        ConversationState conversation = conversation("C-1003", "When was my dividend paid?");

        ModelReply reply = null;
        for (int i = 0; i < 3; i++) {
            reply = client.complete(conversation, List.of());
            advance(conversation, reply, "{}");
        }

        assertEquals(TerminalInterceptor.TERMINAL_TOOL_NAME, reply.getToolInvocation().getName());
        assertEquals("GENERAL_INQUIRY", reply.getToolInvocation().getArgs().path("issue_type").asText());
    }

    @Test
    void testUnauthorizedScriptChecksLogins() {
        ConversationState conversation = conversation("C-1002", "There is a sell order I did not place.");

        advance(conversation, client.complete(conversation, List.of()), "{}");
        ModelReply second = client.complete(conversation, List.of());

        assertEquals("account_login_history", second.getToolInvocation().getName());
    }

    @Test
    void testRolePrompts() {
        String critic = client.generateWithRole(AgentType.CRITIC, "review", 0.0);
        String paraphrase = client.generateWithRole(AgentType.PARAPHRASER, "Rewrite:\n<<<\nWhere is my wire?\n>>>\n", 0.7);

        assertTrue(critic.contains("\"agrees\": true"));
        assertEquals("Hello, following up on this. Where is my wire?", paraphrase);
        assertEquals(MockLLMClient.MODEL, client.modelFor(AgentType.INVESTIGATOR));
    }

    private static ConversationState conversation(String customerId, String message) {
        ConversationState conversation = new ConversationState("system");
        conversation.addUserMessage("Customer ID: " + customerId + "\n\nCustomer message:\n\"" + message + "\"");
        return conversation;
    }

    private static void advance(ConversationState conversation, ModelReply reply, String toolResult) {
        conversation.addAssistantTurn(reply.getText(), reply.getToolInvocation());
        conversation.addToolResult(reply.getToolInvocation().getId(), toolResult, false);
    }
}
