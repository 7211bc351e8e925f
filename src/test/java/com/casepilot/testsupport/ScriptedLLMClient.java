package com.casepilot.testsupport;

import com.casepilot.core.agent.AgentType;
import com.casepilot.core.error.CompletionCapabilityException;
import com.casepilot.core.state.ConversationState;
import com.casepilot.core.terminal.TerminalInterceptor;
import com.casepilot.core.tool.ToolDefinition;
import com.casepilot.llm.LLMClient;
import com.casepilot.llm.ModelReply;
import com.casepilot.llm.ToolInvocation;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

/**
 * Test double for the completion capability. Investigator replies are served from a
 * queue (the last one repeats once the queue is drained); role prompts go to a handler.
 */
public class ScriptedLLMClient implements LLMClient {

    private final Deque<ModelReply> replies = new ArrayDeque<>();
    private ModelReply repeat;
    private Function<String, String> roleHandler = prompt -> "";
    private RuntimeException completionFailure;

    private final List<List<String>> offeredTools = new ArrayList<>();
    private final List<String> rolePrompts = new ArrayList<>();
    private final List<Double> roleTemperatures = new ArrayList<>();
    private int completeCalls;

    public static ModelReply toolCall(String name, JsonNode args) {
        return new ModelReply("calling " + name, new ToolInvocation("toolu_" + name, name, args), 10, 5);
    }

    public static ModelReply terminal(JsonNode payload) {
        return new ModelReply("submitting",
                new ToolInvocation("toolu_final", TerminalInterceptor.TERMINAL_TOOL_NAME, payload), 10, 5);
    }

    public ScriptedLLMClient thenReply(ModelReply reply) {
        replies.add(reply);
        return this;
    }

    /** Serve this reply forever once the queue is empty. */
    public ScriptedLLMClient thenRepeat(ModelReply reply) {
        this.repeat = reply;
        return this;
    }

    public ScriptedLLMClient failCompletionsWith(RuntimeException failure) {
        this.completionFailure = failure;
        return this;
    }

    public ScriptedLLMClient onRolePrompt(Function<String, String> handler) {
        this.roleHandler = handler;
        return this;
    }

    @Override
    public synchronized ModelReply complete(ConversationState conversation, List<ToolDefinition> tools) {
        completeCalls++;
        List<String> names = new ArrayList<>();
        tools.forEach(t -> names.add(t.getName()));
        offeredTools.add(names);

        if (completionFailure != null && replies.isEmpty()) {
            throw completionFailure;
        }
        ModelReply next = replies.poll();
        if (next != null) {
            return next;
        }
        if (repeat != null) {
            return repeat;
        }
        throw new CompletionCapabilityException("script exhausted");
    }

    @Override
    public synchronized String generateWithRole(AgentType role, String userPrompt, double temperature) {
        rolePrompts.add(userPrompt);
        roleTemperatures.add(temperature);
        return roleHandler.apply(userPrompt);
    }

    @Override
    public String modelFor(AgentType role) {
        return "scripted-" + role.name().toLowerCase();
    }

    public synchronized int getCompleteCalls() {
        return completeCalls;
    }

    public synchronized List<List<String>> getOfferedTools() {
        return new ArrayList<>(offeredTools);
    }

    public synchronized List<String> getRolePrompts() {
        return new ArrayList<>(rolePrompts);
    }

    public synchronized List<Double> getRoleTemperatures() {
        return new ArrayList<>(roleTemperatures);
    }
}
