package com.casepilot.core.agent;

import com.casepilot.core.terminal.TerminalInterceptor;
import com.casepilot.llm.ModelReply;
import com.casepilot.llm.ToolInvocation;

/**
 * The model's next move, classified once per turn:
 *
 *   ToolRequest    - a declared tool to dispatch
 *   TerminalAnswer - the reserved terminal tool; never dispatched
 *   TextReply      - prose with no tool call
 *
 * The constructor is private so these three are the only variants.
 */
public abstract class NextAction {

    private final String text;

    private NextAction(String text) {
        this.text = text != null ? text : "";
    }

    public static NextAction classify(ModelReply reply) {
        ToolInvocation invocation = reply.getToolInvocation();
        if (invocation == null) {
            return new TextReply(reply.getText());
        }
        if (TerminalInterceptor.TERMINAL_TOOL_NAME.equals(invocation.getName())) {
            return new TerminalAnswer(reply.getText(), invocation);
        }
        return new ToolRequest(reply.getText(), invocation);
    }

    /** Any prose the model emitted alongside the action. */
    public String getText() {
        return text;
    }

    public static final class ToolRequest extends NextAction {

        private final ToolInvocation invocation;

        private ToolRequest(String text, ToolInvocation invocation) {
            super(text);
            this.invocation = invocation;
        }

        public ToolInvocation getInvocation() {
            return invocation;
        }
    }

    public static final class TerminalAnswer extends NextAction {

        private final ToolInvocation invocation;

        private TerminalAnswer(String text, ToolInvocation invocation) {
            super(text);
            this.invocation = invocation;
        }

        public ToolInvocation getInvocation() {
            return invocation;
        }
    }

    public static final class TextReply extends NextAction {

        private TextReply(String text) {
            super(text);
        }
    }
}
