package com.casepilot.orchestrator;

import com.casepilot.config.CasePilotConfig;
import com.casepilot.config.MockToolConfig;
import com.casepilot.core.critic.CriticReviewer;
import com.casepilot.core.critic.CriticVerdict;
import com.casepilot.core.error.CompletionCapabilityException;
import com.casepilot.core.error.InvalidInputException;
import com.casepilot.core.executor.BoundedCallExecutor;
import com.casepilot.core.issue.Issue;
import com.casepilot.core.issue.IssueRepository;
import com.casepilot.core.issue.IssueService;
import com.casepilot.core.issue.IssueStatus;
import com.casepilot.core.issue.UrgencyTier;
import com.casepilot.core.policy.PolicyEvaluator;
import com.casepilot.core.policy.PolicyFlags;
import com.casepilot.core.terminal.EscalationPriority;
import com.casepilot.core.terminal.ResolutionType;
import com.casepilot.core.terminal.TerminalInterceptor;
import com.casepilot.core.tool.ArgsDigest;
import com.casepilot.core.tool.ToolBindings;
import com.casepilot.core.tool.ToolCallRecord;
import com.casepilot.core.tool.ToolCatalog;
import com.casepilot.core.tool.ToolCatalogEntry;
import com.casepilot.core.tool.ToolClass;
import com.casepilot.core.tool.ToolDispatcher;
import com.casepilot.core.tool.ToolResult;
import com.casepilot.core.tool.ToolResultCache;
import com.casepilot.core.trace.InMemoryRunTraceRepository;
import com.casepilot.core.trace.RunStatus;
import com.casepilot.core.trace.RunTrace;
import com.casepilot.llm.LLMClient;
import com.casepilot.llm.MockLLMClient;
import com.casepilot.llm.ModelReply;
import com.casepilot.testsupport.MutableClock;
import com.casepilot.testsupport.ScriptedLLMClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.casepilot.testsupport.ScriptedLLMClient.terminal;
import static com.casepilot.testsupport.ScriptedLLMClient.toolCall;
import static org.junit.jupiter.api.Assertions.*;

class InvestigationOrchestratorTest {

    private static final String WIRE_MESSAGE =
            "I sent a $15,000 wire to my cash account 4 days ago and it still hasn't arrived.";
    private static final String TRADE_MESSAGE =
            "There is a sell order for $8,400 on my account that I did not place.";

    private final ObjectMapper mapper = new ObjectMapper();

    private MutableClock clock;
    private BoundedCallExecutor executor;
    private ToolCatalog catalog;
    private ToolBindings fixtureBindings;
    private InMemoryRunTraceRepository traces;
    private IssueService issues;
    private ScriptedLLMClient llm;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
        executor = new BoundedCallExecutor(4);
        catalog = new CasePilotConfig().toolCatalog(mapper);
        fixtureBindings = new MockToolConfig().toolBindings(catalog, mapper);
        traces = new InMemoryRunTraceRepository();
        issues = new IssueService(new IssueRepository());
        llm = new ScriptedLLMClient()
                .onRolePrompt(prompt -> "{\"agrees\": true, \"note\": \"Verdict is consistent.\"}");

        issues.register(Issue.open("ISS-1001", "C-1001", WIRE_MESSAGE, "chat", UrgencyTier.HIGH));
        issues.register(Issue.open("ISS-1002", "C-1002", TRADE_MESSAGE, "email", UrgencyTier.CRITICAL));
    }

    @AfterEach
    void tearDown() {
        executor.destroy();
    }

    // =========================================================================
    // Scenarios
    // =========================================================================

    @Test
    void testWireDelayIsAutoResolvedWithAuditTrail() {
        llm.thenReply(toolCall("customer_lookup", args("customer_id", "C-1001")))
                .thenReply(toolCall("account_lookup", args("customer_id", "C-1001")))
                .thenReply(toolCall("transactions_search", args("account_id", "A-1001-CASH")
                        .put("transaction_type", "wire_in").put("days", 7)))
                .thenReply(terminal(verdict("WIRE_TRANSFER_DELAY", "AUTO_RESOLVED", 0.88, false)
                        .set("policy_flags", mapper.createArrayNode().add("AML_REVIEW_TRIGGERED"))));

        RunTrace trace = orchestrator(fixtureDispatcher()).run(issues.getIssue("ISS-1001"));

        assertEquals(RunStatus.COMPLETED, trace.getStatus());
        assertEquals(ResolutionType.AUTO_RESOLVED, trace.getOutput().getResolutionType());
        assertFalse(trace.getOutput().isEscalate());
        assertTrue(trace.getOutput().hasFlag(PolicyFlags.AML_REVIEW_TRIGGERED));
        assertEquals(4, trace.getTurnsTaken());

        List<ToolCallRecord> calls = trace.getToolCalls();
        assertEquals(List.of("customer_lookup", "account_lookup", "transactions_search"),
                calls.stream().map(ToolCallRecord::getTool).toList());
        assertEquals(List.of(1, 2, 3), calls.stream().map(ToolCallRecord::getTurn).toList());
        assertTrue(calls.stream().noneMatch(ToolCallRecord::isError));

        assertEquals(40, trace.getTokenUsage().getInputTokens());
        assertEquals(20, trace.getTokenUsage().getOutputTokens());
        assertEquals(Boolean.TRUE, trace.getCriticAgrees());
        assertEquals(IssueStatus.RESOLVED, issues.getIssue("ISS-1001").getStatus());
        assertSame(trace, traces.findById(trace.getTraceId()).orElseThrow());
    }

    @Test
    void testUnauthorizedTradeIsEscalatedByPolicy() {
        llm.thenReply(toolCall("customer_lookup", args("customer_id", "C-1002")))
                .thenReply(toolCall("account_login_history", args("customer_id", "C-1002")))
                .thenReply(terminal(verdict("UNAUTHORIZED_TRADE", "AUTO_RESOLVED", 0.93, false)));

        RunTrace trace = orchestrator(fixtureDispatcher()).run(issues.getIssue("ISS-1002"));

        assertEquals(RunStatus.ESCALATED, trace.getStatus());
        assertEquals(ResolutionType.ESCALATED, trace.getOutput().getResolutionType());
        assertTrue(trace.getOutput().isEscalate());
        assertEquals(EscalationPriority.CRITICAL, trace.getOutput().getEscalationPriority());
        assertTrue(trace.getOutput().hasFlag(PolicyFlags.MANDATORY_ESCALATION));
        assertEquals(IssueStatus.ESCALATED, issues.getIssue("ISS-1002").getStatus());
    }

    @Test
    void testTerminalToolIsOfferedButNeverRecorded() {
        llm.thenReply(toolCall("customer_lookup", args("customer_id", "C-1001")))
                .thenReply(terminal(verdict("GENERAL_INQUIRY", "AUTO_RESOLVED", 0.9, false)));

        RunTrace trace = orchestrator(fixtureDispatcher()).run(issues.getIssue("ISS-1001"));

        assertEquals(1, trace.getToolCalls().size());
        assertTrue(trace.getToolCalls().stream()
                .noneMatch(r -> TerminalInterceptor.TERMINAL_TOOL_NAME.equals(r.getTool())));
        for (List<String> offered : llm.getOfferedTools()) {
            assertTrue(offered.contains(TerminalInterceptor.TERMINAL_TOOL_NAME));
            assertEquals(catalog.size() + 1, offered.size());
        }
    }

    @Test
    void testExhaustedTurnsEscalateWithExactlyFifteenRecords() {
        llm.thenRepeat(toolCall("customer_lookup", args("customer_id", "C-1001")));

        RunTrace trace = orchestrator(fixtureDispatcher()).run(issues.getIssue("ISS-1001"));

        assertEquals(RunStatus.ESCALATED, trace.getStatus());
        assertEquals(InvestigationOrchestrator.MAX_TURNS, trace.getToolCalls().size());
        assertEquals(InvestigationOrchestrator.MAX_TURNS, trace.getTurnsTaken());
        assertEquals(InvestigationOrchestrator.MAX_TURNS, llm.getCompleteCalls());
        assertTrue(trace.getOutput().isEscalate());
        assertEquals(ResolutionType.ESCALATED, trace.getOutput().getResolutionType());
        assertTrue(trace.getOutput().hasFlag(PolicyFlags.MAX_TURNS_EXCEEDED));
        assertEquals(EscalationPriority.MEDIUM, trace.getOutput().getEscalationPriority());

        assertFalse(trace.getToolCalls().get(0).isCacheHit());
        assertTrue(trace.getToolCalls().subList(1, 15).stream().allMatch(ToolCallRecord::isCacheHit));
    }

    @Test
    void testTextReplyConsumesTurn() {
        llm.thenReply(ModelReply.text("Let me think about this."))
                .thenReply(terminal(verdict("GENERAL_INQUIRY", "AUTO_RESOLVED", 0.8, false)));

        RunTrace trace = orchestrator(fixtureDispatcher()).run(issues.getIssue("ISS-1001"));

        assertEquals(RunStatus.COMPLETED, trace.getStatus());
        assertEquals(2, trace.getTurnsTaken());
        assertTrue(trace.getToolCalls().isEmpty());
        assertTrue(trace.reasoningText().contains("Let me think"));
    }

    // =========================================================================
    // Failures
    // =========================================================================

    @Test
    void testCompletionFailureKeepsCapturedToolCalls() {
        llm.thenReply(toolCall("customer_lookup", args("customer_id", "C-1001")))
                .thenReply(toolCall("account_lookup", args("customer_id", "C-1001")))
                .failCompletionsWith(new CompletionCapabilityException("upstream overloaded (529)"));

        RunTrace trace = orchestrator(fixtureDispatcher()).run(issues.getIssue("ISS-1001"));

        assertEquals(RunStatus.FAILED, trace.getStatus());
        assertNull(trace.getOutput());
        assertEquals(2, trace.getToolCalls().size());
        assertTrue(trace.getErrorMessage().contains("529"));
        assertNotNull(trace.getCompletedAt());
        assertEquals(IssueStatus.OPEN, issues.getIssue("ISS-1001").getStatus());
    }

    @Test
    void testMalformedTerminalOutputFailsRun() {
        llm.thenReply(terminal(verdict("GENERAL_INQUIRY", "AUTO_RESOLVED", 1.4, false)));

        RunTrace trace = orchestrator(fixtureDispatcher()).run(issues.getIssue("ISS-1001"));

        assertEquals(RunStatus.FAILED, trace.getStatus());
        assertNull(trace.getOutput());
        assertTrue(trace.getErrorMessage().startsWith("Malformed terminal output"));
    }

    @Test
    void testNonRecoverableToolFailureFailsRunWithErrorRecord() {
        ToolCatalog ledgerCatalog = new ToolCatalog(List.of(new ToolCatalogEntry(
                "ledger_lookup", "core ledger", mapper.createObjectNode().put("type", "object"),
                ToolClass.LOOKUP, false)));
        ToolBindings ledgerBindings = new ToolBindings(Map.of(
                "ledger_lookup", a -> ToolResult.error("ledger unreachable")));
        ToolDispatcher dispatcher = new ToolDispatcher(ledgerCatalog, ledgerBindings, cache(), executor,
                Duration.ofSeconds(2));
        llm.thenReply(toolCall("ledger_lookup", args("account_id", "A-1")));

        RunTrace trace = orchestrator(dispatcher, ledgerCatalog).run(issues.getIssue("ISS-1001"));

        assertEquals(RunStatus.FAILED, trace.getStatus());
        assertEquals(1, trace.getToolCalls().size());
        assertTrue(trace.getToolCalls().get(0).isError());
        assertTrue(trace.getErrorMessage().contains("ledger unreachable"));
    }

    @Test
    void testRecoverableToolErrorIsFedBackAndRunContinues() {
        llm.thenReply(toolCall("customer_lookup", args("customer_id", "C-404")))
                .thenReply(terminal(verdict("GENERAL_INQUIRY", "ESCALATED", 0.5, true)));

        RunTrace trace = orchestrator(fixtureDispatcher()).run(issues.getIssue("ISS-1001"));

        assertEquals(RunStatus.ESCALATED, trace.getStatus());
        assertEquals(1, trace.getToolCalls().size());
    }

    @Test
    void testBlankMessageIsRejectedWithoutTrace() {
        Issue blank = Issue.open("ISS-9", "C-9", "   ", "chat", UrgencyTier.LOW);

        assertThrows(InvalidInputException.class, () -> orchestrator(fixtureDispatcher()).run(blank));
        assertTrue(traces.findByIssueId("ISS-9", true).isEmpty());
        assertEquals(0, llm.getCompleteCalls());
    }

    @Test
    void testCriticFailureIsNotFatal() {
        llm.onRolePrompt(prompt -> {
            throw new IllegalStateException("critic model offline");
        });
        llm.thenReply(terminal(verdict("GENERAL_INQUIRY", "AUTO_RESOLVED", 0.85, false)));

        RunTrace trace = orchestrator(fixtureDispatcher()).run(issues.getIssue("ISS-1001"));

        assertEquals(RunStatus.COMPLETED, trace.getStatus());
        assertEquals(Boolean.TRUE, trace.getCriticAgrees());
        assertEquals(CriticVerdict.UNAVAILABLE_NOTE, trace.getCriticNotes());
    }

    @Test
    void testReplayChildSkipsCriticAndLeavesIssueStatus() {
        llm.thenReply(terminal(verdict("GENERAL_INQUIRY", "AUTO_RESOLVED", 0.85, false)));

        RunTrace trace = orchestrator(fixtureDispatcher())
                .run(issues.getIssue("ISS-1001"), RunOptions.replayOf("source-trace"));

        assertTrue(trace.isReplay());
        assertEquals("source-trace", trace.getSourceTraceId());
        assertNull(trace.getCriticAgrees());
        assertTrue(llm.getRolePrompts().isEmpty());
        assertEquals(IssueStatus.OPEN, issues.getIssue("ISS-1001").getStatus());
        assertTrue(traces.findByIssueId("ISS-1001", false).isEmpty());
        assertEquals(1, traces.findByIssueId("ISS-1001", true).size());
    }

    @Test
    void testConcurrentInvestigationsShareOnlyTheCache() throws Exception {
        String[][] cases = {
                {"C-1001", "I sent a wire to my cash account last week and it never arrived.", "WIRE_TRANSFER_DELAY"},
                {"C-1002", "There is a sell order on my account that I did not place.", "UNAUTHORIZED_TRADE"},
                {"C-1003", "When was my last dividend paid?", "GENERAL_INQUIRY"},
        };
        int perCase = 3;
        List<Issue> submitted = new ArrayList<>();
        for (int i = 0; i < cases.length * perCase; i++) {
            String[] c = cases[i % cases.length];
            Issue issue = Issue.open("ISS-P" + i, c[0], c[1], "chat", UrgencyTier.MEDIUM);
            issues.register(issue);
            submitted.add(issue);
        }

        ToolResultCache sharedCache = cache();
        ToolDispatcher dispatcher = new ToolDispatcher(catalog, fixtureBindings, sharedCache, executor, Duration.ofSeconds(2));
        InvestigationOrchestrator orchestrator = orchestrator(dispatcher, catalog, new MockLLMClient(mapper));

        ExecutorService investigations = Executors.newFixedThreadPool(submitted.size());
        CountDownLatch go = new CountDownLatch(1);
        List<Future<RunTrace>> futures = new ArrayList<>();
        try {
            for (Issue issue : submitted) {
                futures.add(investigations.submit(() -> {
                    go.await();
                    return orchestrator.run(issue);
                }));
            }
            go.countDown();

            int hits = 0;
            int misses = 0;
            for (int i = 0; i < futures.size(); i++) {
                RunTrace trace = futures.get(i).get(30, TimeUnit.SECONDS);
                Issue issue = submitted.get(i);
                String expectedType = cases[i % cases.length][2];

                assertEquals(issue.getIssueId(), trace.getIssueId());
                assertNotNull(trace.getOutput(), "trace " + trace.getTraceId() + " has a verdict");
                assertEquals(expectedType, trace.getOutput().getIssueType());
                assertEquals(expectedType.equals("UNAUTHORIZED_TRADE") ? RunStatus.ESCALATED : RunStatus.COMPLETED,
                        trace.getStatus());
                assertEquals(expectedType.equals("GENERAL_INQUIRY") ? 2 : 4, trace.getToolCalls().size());

                ToolCallRecord first = trace.getToolCalls().get(0);
                assertEquals("customer_lookup", first.getTool());
                assertEquals(ArgsDigest.of(args("customer_id", issue.getCustomerId()), ArgsDigest.RECORD_LENGTH),
                        first.getArgsDigest());
                assertEquals(List.of(1, 2), trace.getToolCalls().stream().limit(2).map(ToolCallRecord::getTurn).toList());

                for (ToolCallRecord record : trace.getToolCalls()) {
                    assertFalse(record.isError());
                    if (record.isCacheHit()) hits++; else misses++;
                }
                assertSame(trace, traces.findById(trace.getTraceId()).orElseThrow());
                assertEquals(List.of(trace), traces.findByIssueId(issue.getIssueId(), true));
            }

            assertEquals(hits, sharedCache.getHitCount());
            assertEquals(misses, sharedCache.getMissCount());
            assertEquals(3 * (4 + 4 + 2), hits + misses);
        } finally {
            investigations.shutdownNow();
        }
    }

    // =========================================================================
    // Wiring
    // =========================================================================

    private InvestigationOrchestrator orchestrator(ToolDispatcher dispatcher) {
        return orchestrator(dispatcher, catalog);
    }

    private InvestigationOrchestrator orchestrator(ToolDispatcher dispatcher, ToolCatalog toolCatalog) {
        return orchestrator(dispatcher, toolCatalog, llm);
    }

    private InvestigationOrchestrator orchestrator(ToolDispatcher dispatcher, ToolCatalog toolCatalog, LLMClient model) {
        return new InvestigationOrchestrator(
                model,
                toolCatalog,
                dispatcher,
                new TerminalInterceptor(mapper),
                new PolicyEvaluator(mapper, 0.6),
                new CriticReviewer(llm, mapper),
                traces,
                issues,
                executor,
                clock,
                Duration.ofSeconds(5),
                true,
                0.0);
    }

    private ToolDispatcher fixtureDispatcher() {
        return new ToolDispatcher(catalog, fixtureBindings, cache(), executor, Duration.ofSeconds(2));
    }

    private ToolResultCache cache() {
        return new ToolResultCache(clock, Duration.ofSeconds(60), Duration.ofSeconds(120), Duration.ofSeconds(300));
    }

    private ObjectNode args(String key, String value) {
        return mapper.createObjectNode().put(key, value);
    }

    private ObjectNode verdict(String issueType, String resolutionType, double confidence, boolean escalate) {
        return mapper.createObjectNode()
                .put("issue_type", issueType)
                .put("root_cause", "Determined from account records.")
                .put("resolution", "Explained to the customer.")
                .put("resolution_type", resolutionType)
                .put("confidence_score", confidence)
                .put("escalate", escalate);
    }
}
