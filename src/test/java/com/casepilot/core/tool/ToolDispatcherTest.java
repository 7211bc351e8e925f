package com.casepilot.core.tool;

import com.casepilot.core.error.ToolDispatchException;
import com.casepilot.core.executor.BoundedCallExecutor;
import com.casepilot.testsupport.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ToolDispatcherTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private BoundedCallExecutor executor;
    private ToolResultCache cache;
    private AtomicInteger lookupCalls;
    private AtomicInteger flakyCalls;

    @BeforeEach
    void setUp() {
        executor = new BoundedCallExecutor(4);
        cache = new ToolResultCache(new MutableClock(Instant.parse("2026-03-02T10:00:00Z")),
                Duration.ofSeconds(60), Duration.ofSeconds(120), Duration.ofSeconds(300));
        lookupCalls = new AtomicInteger();
        flakyCalls = new AtomicInteger();
    }

    @AfterEach
    void tearDown() {
        executor.destroy();
    }

    @Test
    void testSecondIdenticalCallIsServedFromCache() {
        ToolDispatcher dispatcher = dispatcher(Duration.ofSeconds(5));
        JsonNode args = args("customer_id", "C-1001");

        ToolOutcome first = dispatcher.dispatch("customer_lookup", args, 1);
        ToolOutcome second = dispatcher.dispatch("customer_lookup", args, 2);

        assertFalse(first.getRecord().isCacheHit());
        assertTrue(second.getRecord().isCacheHit());
        assertEquals(1, lookupCalls.get(), "collaborator should run once");
        assertTrue(second.getRecord().getLatencyMs() < first.getRecord().getLatencyMs());
        assertEquals(first.getContent(), second.getContent());
        assertEquals(2, second.getRecord().getTurn());
    }

    @Test
    void testArgumentKeyOrderDoesNotAffectDigestOrCache() {
        ToolDispatcher dispatcher = dispatcher(Duration.ofSeconds(5));
        ObjectNode ab = mapper.createObjectNode().put("customer_id", "C-1").put("days", 7);
        ObjectNode ba = mapper.createObjectNode().put("days", 7).put("customer_id", "C-1");

        ToolOutcome first = dispatcher.dispatch("customer_lookup", ab, 1);
        ToolOutcome second = dispatcher.dispatch("customer_lookup", ba, 2);

        assertEquals(first.getRecord().getArgsDigest(), second.getRecord().getArgsDigest());
        assertEquals(ArgsDigest.RECORD_LENGTH, first.getRecord().getArgsDigest().length());
        assertTrue(second.getRecord().isCacheHit());
    }

    @Test
    void testDifferentArgumentsMissTheCache() {
        ToolDispatcher dispatcher = dispatcher(Duration.ofSeconds(5));

        dispatcher.dispatch("customer_lookup", args("customer_id", "C-1"), 1);
        ToolOutcome other = dispatcher.dispatch("customer_lookup", args("customer_id", "C-2"), 2);

        assertFalse(other.getRecord().isCacheHit());
        assertEquals(2, lookupCalls.get());
    }

    @Test
    void testRecoverableErrorBecomesErrorRecordAndIsNotCached() {
        ToolDispatcher dispatcher = dispatcher(Duration.ofSeconds(5));
        JsonNode args = args("query", "wire hold");

        ToolOutcome first = dispatcher.dispatch("policy_search", args, 1);
        ToolOutcome second = dispatcher.dispatch("policy_search", args, 2);

        assertTrue(first.getRecord().isError());
        assertTrue(first.getRecord().getResultSummary().startsWith("ERROR:"));
        assertTrue(first.getContent().contains("\"error\""));
        assertFalse(second.getRecord().isCacheHit(), "errors must not be cached");
        assertEquals(2, flakyCalls.get());
        assertEquals(0, cache.size());
    }

    @Test
    void testThrowingRecoverableCollaboratorIsToolLevelFailure() {
        ToolDispatcher dispatcher = dispatcher(Duration.ofSeconds(5));

        ToolOutcome outcome = dispatcher.dispatch("cases_similar", args("query", "x"), 3);

        assertTrue(outcome.getRecord().isError());
        assertTrue(outcome.getRecord().getResultSummary().contains("vector store offline"));
    }

    @Test
    void testNonRecoverableFailureRaisesWithRecord() {
        ToolDispatcher dispatcher = dispatcher(Duration.ofSeconds(5));

        ToolDispatchException e = assertThrows(ToolDispatchException.class,
                () -> dispatcher.dispatch("transactions_search", args("account_id", "A-1"), 4));

        assertNotNull(e.getRecord());
        assertTrue(e.getRecord().isError());
        assertEquals("transactions_search", e.getRecord().getTool());
        assertEquals(4, e.getRecord().getTurn());
    }

    @Test
    void testUnknownToolIsErrorRecordNotException() {
        ToolDispatcher dispatcher = dispatcher(Duration.ofSeconds(5));

        ToolOutcome outcome = dispatcher.dispatch("delete_customer", args("customer_id", "C-1"), 1);

        assertTrue(outcome.getRecord().isError());
        assertTrue(outcome.getContent().contains("Unknown tool"));
    }

    @Test
    void testSlowToolTimesOut() {
        ToolDispatcher dispatcher = dispatcher(Duration.ofMillis(50));

        ToolOutcome outcome = dispatcher.dispatch("account_lookup", args("customer_id", "C-1"), 1);

        assertTrue(outcome.getRecord().isError());
        assertTrue(outcome.getRecord().getResultSummary().contains("timed out"));
    }

    // =========================================================================
    // Fixture wiring
    // =========================================================================

    private ToolDispatcher dispatcher(Duration timeout) {
        JsonNode schema = mapper.createObjectNode().put("type", "object");
        ToolCatalog catalog = new ToolCatalog(List.of(
                new ToolCatalogEntry("customer_lookup", "profile", schema, ToolClass.LOOKUP, true),
                new ToolCatalogEntry("account_lookup", "accounts", schema, ToolClass.LOOKUP, true),
                new ToolCatalogEntry("policy_search", "policy", schema, ToolClass.REFERENCE_SEARCH, true),
                new ToolCatalogEntry("cases_similar", "cases", schema, ToolClass.SIMILARITY_SEARCH, true),
                new ToolCatalogEntry("transactions_search", "tx", schema, ToolClass.LOOKUP, false)));

        ToolCollaborator customerLookup = args -> {
            lookupCalls.incrementAndGet();
            Thread.sleep(5);
            return ToolResult.ok(mapper.createObjectNode()
                    .put("customer_id", args.path("customer_id").asText())
                    .put("name", "Jordan Lee")
                    .put("kyc_status", "verified"));
        };
        ToolCollaborator slow = args -> {
            Thread.sleep(2_000);
            return ToolResult.ok(mapper.createObjectNode());
        };
        ToolCollaborator flaky = args -> {
            flakyCalls.incrementAndGet();
            return ToolResult.error("policy index unavailable");
        };
        ToolCollaborator throwing = args -> {
            throw new IllegalStateException("vector store offline");
        };
        ToolCollaborator broken = args -> ToolResult.error("ledger connection refused");

        ToolBindings bindings = new ToolBindings(Map.of(
                "customer_lookup", customerLookup,
                "account_lookup", slow,
                "policy_search", flaky,
                "cases_similar", throwing,
                "transactions_search", broken));

        return new ToolDispatcher(catalog, bindings, cache, executor, timeout);
    }

    private JsonNode args(String key, String value) {
        return mapper.createObjectNode().put(key, value);
    }
}
