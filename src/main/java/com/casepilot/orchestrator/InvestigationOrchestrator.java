package com.casepilot.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.casepilot.core.agent.AgentType;
import com.casepilot.core.agent.NextAction;
import com.casepilot.core.critic.CriticReviewer;
import com.casepilot.core.critic.CriticVerdict;
import com.casepilot.core.error.CompletionCapabilityException;
import com.casepilot.core.error.InvalidInputException;
import com.casepilot.core.error.MalformedTerminalOutputException;
import com.casepilot.core.error.ToolDispatchException;
import com.casepilot.core.executor.BoundedCallExecutor;
import com.casepilot.core.issue.Issue;
import com.casepilot.core.issue.IssueService;
import com.casepilot.core.policy.PolicyEvaluator;
import com.casepilot.core.policy.PolicyFlags;
import com.casepilot.core.state.ConversationState;
import com.casepilot.core.terminal.EscalationPriority;
import com.casepilot.core.terminal.ResolutionType;
import com.casepilot.core.terminal.StructuredOutput;
import com.casepilot.core.terminal.TerminalInterceptor;
import com.casepilot.core.tool.ToolCatalog;
import com.casepilot.core.tool.ToolDefinition;
import com.casepilot.core.tool.ToolDispatcher;
import com.casepilot.core.tool.ToolOutcome;
import com.casepilot.core.trace.RunTrace;
import com.casepilot.core.trace.RunTraceRepository;
import com.casepilot.core.trace.TraceContext;
import com.casepilot.llm.LLMClient;
import com.casepilot.llm.ModelReply;
import com.casepilot.llm.ToolInvocation;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * InvestigationOrchestrator - the turn-bounded tool-use loop.
 *
 * Per turn: ask the model for its next action, then
 *   TerminalAnswer → validate, apply policy, finish (COMPLETED / ESCALATED)
 *   ToolRequest    → dispatch, record, feed the result back
 *   TextReply      → remind the model to use a tool; the turn still counts
 *
 * Running out of turns is a verdict (ESCALATED, MAX_TURNS_EXCEEDED), not an error.
 * Completion failures, non-recoverable tool failures and malformed terminal payloads
 * end the run FAILED with the tool calls captured so far and no verdict.
 */
@Component
public class InvestigationOrchestrator implements InvestigationRunner {

    private static final Logger log = LoggerFactory.getLogger(InvestigationOrchestrator.class);

    public static final int MAX_TURNS = 15;

    private final LLMClient           llmClient;
    private final ToolCatalog         toolCatalog;
    private final ToolDispatcher      toolDispatcher;
    private final TerminalInterceptor terminalInterceptor;
    private final PolicyEvaluator     policyEvaluator;
    private final CriticReviewer      criticReviewer;
    private final RunTraceRepository  traceRepository;
    private final IssueService        issueService;
    private final BoundedCallExecutor boundedCalls;
    private final Clock               clock;
    private final Duration            llmTimeout;
    private final boolean             criticEnabled;
    private final double              exhaustedConfidence;

    public InvestigationOrchestrator(
            LLMClient           llmClient,
            ToolCatalog         toolCatalog,
            ToolDispatcher      toolDispatcher,
            TerminalInterceptor terminalInterceptor,
            PolicyEvaluator     policyEvaluator,
            CriticReviewer      criticReviewer,
            RunTraceRepository  traceRepository,
            IssueService        issueService,
            BoundedCallExecutor boundedCalls,
            Clock               clock,
            @Value("${casepilot.llm.timeout:60s}")                   Duration llmTimeout,
            @Value("${casepilot.critic.enabled:true}")               boolean criticEnabled,
            @Value("${casepilot.orchestrator.exhausted-confidence:0.0}") double exhaustedConfidence
    ) {
        this.llmClient           = llmClient;
        this.toolCatalog         = toolCatalog;
        this.toolDispatcher      = toolDispatcher;
        this.terminalInterceptor = terminalInterceptor;
        this.policyEvaluator     = policyEvaluator;
        this.criticReviewer      = criticReviewer;
        this.traceRepository     = traceRepository;
        this.issueService        = issueService;
        this.boundedCalls        = boundedCalls;
        this.clock               = clock;
        this.llmTimeout          = llmTimeout;
        this.criticEnabled       = criticEnabled;
        this.exhaustedConfidence = exhaustedConfidence;
    }

    // =========================================================================
    // MAIN ENTRY POINT
    // =========================================================================

    public RunTrace run(Issue issue) {
        return run(issue, RunOptions.primary());
    }

    /**
     * @throws InvalidInputException if the issue message is blank; no trace is created
     */
    @Override
    public RunTrace run(Issue issue, RunOptions options) {
        if (issue == null || issue.getRawMessage() == null || issue.getRawMessage().isBlank()) {
            throw new InvalidInputException("Issue "
                    + (issue != null ? issue.getIssueId() : "null") + " has an empty message");
        }

        String model = llmClient.modelFor(AgentType.INVESTIGATOR);
        RunTrace trace = options.isReplay()
                ? RunTrace.startReplay(issue.getIssueId(), options.getSourceTraceId(), model, clock.instant())
                : RunTrace.start(issue.getIssueId(), model, clock.instant());

        try (MDC.MDCCloseable ignored = TraceContext.bind(trace.getTraceId())) {
            log.info("========== INVESTIGATION START issue={} replay={} ==========",
                    issue.getIssueId(), options.isReplay());

            persist("create", trace, () -> traceRepository.create(trace));
            if (options.changesIssueStatus()) {
                issueService.markInvestigating(issue.getIssueId());
            }

            runLoop(issue, trace, options);

            persist("update", trace, () -> traceRepository.update(trace));
            if (options.changesIssueStatus()) {
                updateIssueStatus(trace);
            }
            logSummary(trace);
            return trace;
        }
    }

    // =========================================================================
    // Loop
    // =========================================================================

    private void runLoop(Issue issue, RunTrace trace, RunOptions options) {
        ConversationState conversation = new ConversationState(SystemPrompts.INVESTIGATOR);
        conversation.addUserMessage(SystemPrompts.issueContext(issue));

        List<ToolDefinition> tools = new ArrayList<>(toolCatalog.definitions());
        tools.add(terminalInterceptor.definition());

        StructuredOutput verdict = null;
        int turn = 0;

        try {
            while (verdict == null && turn < MAX_TURNS) {
                turn++;
                ModelReply reply = requestNextAction(conversation, tools);
                trace.addTokens(reply.getInputTokens(), reply.getOutputTokens());
                trace.addReasoning(reply.getText());

                NextAction action = NextAction.classify(reply);

                if (action instanceof NextAction.TerminalAnswer) {
                    verdict = terminalInterceptor.intercept(action)
                            .orElseThrow(() -> new IllegalStateException("Terminal answer without a verdict"));
                    log.info("[Orchestrator] Turn {}: terminal answer received", turn);

                } else if (action instanceof NextAction.ToolRequest) {
                    ToolInvocation invocation = ((NextAction.ToolRequest) action).getInvocation();
                    conversation.addAssistantTurn(reply.getText(), invocation);

                    ToolOutcome outcome = toolDispatcher.dispatch(invocation.getName(), invocation.getArgs(), turn);
                    trace.addToolCall(outcome.getRecord());
                    conversation.addToolResult(invocation.getId(), outcome.getContent(), outcome.getRecord().isError());

                    log.info("[Orchestrator] Turn {}: {} -> {}", turn, invocation.getName(),
                            outcome.getRecord().getResultSummary());

                } else {
                    log.warn("[Orchestrator] Turn {}: text reply without a tool call", turn);
                    conversation.addAssistantTurn(reply.getText(), null);
                    conversation.addUserMessage(SystemPrompts.TERMINAL_REMINDER);
                }
            }

            trace.setTurnsTaken(turn);

            if (verdict == null) {
                log.warn("[Orchestrator] No resolution after {} turns. Escalating.", MAX_TURNS);
                verdict = exhaustedVerdict();
            }

            verdict = policyEvaluator.apply(verdict);

        } catch (ToolDispatchException e) {
            trace.addToolCall(e.getRecord());
            failRun(trace, turn, e.getMessage());
            return;
        } catch (MalformedTerminalOutputException e) {
            failRun(trace, turn, "Malformed terminal output: " + e.getMessage());
            return;
        } catch (CompletionCapabilityException e) {
            failRun(trace, turn, e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Unexpected failure", e);
            failRun(trace, turn, "Unexpected error: " + e.getMessage());
            return;
        }

        if (options.isCriticRequested() && criticEnabled) {
            CriticVerdict critic = reviewQuietly(issue.getIssueId(), verdict, trace.reasoningText());
            trace.recordCritic(critic.isAgrees(), critic.getNotes(), critic.getModel());
        }

        trace.finish(verdict, clock.instant());
    }

    private ModelReply requestNextAction(ConversationState conversation, List<ToolDefinition> tools) {
        try {
            ModelReply reply = boundedCalls.call(() -> llmClient.complete(conversation, tools), llmTimeout);
            if (reply == null) {
                throw new CompletionCapabilityException("Completion capability returned no reply");
            }
            return reply;
        } catch (TimeoutException e) {
            throw new CompletionCapabilityException(
                    "Completion timed out after " + llmTimeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof CompletionCapabilityException) {
                throw (CompletionCapabilityException) cause;
            }
            throw new CompletionCapabilityException("Completion failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            throw new CompletionCapabilityException("Completion interrupted", e);
        }
    }

    private StructuredOutput exhaustedVerdict() {
        return StructuredOutput.builder(ResolutionType.ESCALATED, exhaustedConfidence, true)
                .issueType("GENERAL")
                .rootCause("Investigation did not reach a conclusion within the allowed turns.")
                .resolution("Escalating for human review.")
                .nextStep("Human agent to review the investigation trace and complete it manually.")
                .escalationPriority(EscalationPriority.MEDIUM)
                .policyFlag(PolicyFlags.MAX_TURNS_EXCEEDED)
                .build();
    }

    private CriticVerdict reviewQuietly(String issueId, StructuredOutput verdict, String reasoning) {
        try {
            return boundedCalls.call(() -> criticReviewer.review(issueId, verdict, reasoning), llmTimeout);
        } catch (TimeoutException | ExecutionException | InterruptedException e) {
            log.warn("[Orchestrator] Critic review did not complete: {}", e.toString());
            return CriticVerdict.unavailable(llmClient.modelFor(AgentType.CRITIC));
        }
    }

    // =========================================================================
    // Terminal transitions
    // =========================================================================

    private void failRun(RunTrace trace, int turn, String message) {
        log.error("[Orchestrator] Investigation failed on turn {}: {}", turn, message);
        trace.setTurnsTaken(turn);
        trace.fail(message, clock.instant());
    }

    private void updateIssueStatus(RunTrace trace) {
        switch (trace.getStatus()) {
            case COMPLETED -> issueService.markResolved(trace.getIssueId());
            case ESCALATED -> issueService.markEscalated(trace.getIssueId());
            case FAILED    -> issueService.reopen(trace.getIssueId());
            default        -> log.warn("[Orchestrator] Trace {} left in {}", trace.getTraceId(), trace.getStatus());
        }
    }

    private void persist(String operation, RunTrace trace, Runnable write) {
        try {
            write.run();
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Trace {} {} failed; continuing with in-memory verdict: {}",
                    trace.getTraceId(), operation, e.getMessage());
        }
    }

    private void logSummary(RunTrace trace) {
        StructuredOutput output = trace.getOutput();
        String json = String.format(
                "{\"trace_id\":\"%s\",\"issue_id\":\"%s\",\"status\":\"%s\",\"turns\":%d," +
                "\"tool_calls\":%d,\"resolution_type\":\"%s\",\"confidence\":%s,\"escalate\":%s," +
                "\"tokens\":%d,\"duration_ms\":%s,\"replay\":%b}",
                trace.getTraceId(), trace.getIssueId(), trace.getStatus(), trace.getTurnsTaken(),
                trace.getToolCalls().size(),
                output != null ? output.getResolutionType() : "",
                output != null ? output.getConfidenceScore() : "null",
                output != null ? output.isEscalate() : "null",
                trace.getTokenUsage().getTotalTokens(),
                trace.getDurationMs(),
                trace.isReplay());
        log.info("[Investigation] {}", json);
    }
}
