package com.casepilot.core.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.casepilot.core.error.ToolDispatchException;
import com.casepilot.core.executor.BoundedCallExecutor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Executes declared tools with caching, latency measurement and explicit cache-hit reporting.
 *
 * Never returns null. Every failure (unknown tool, collaborator exception, error envelope,
 * timeout) becomes an error ToolCallRecord; only tools declared non-recoverable turn that
 * record into a {@link ToolDispatchException}. Error results are never cached.
 */
@Component
public class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    private final ToolCatalog catalog;
    private final ToolBindings bindings;
    private final ToolResultCache cache;
    private final BoundedCallExecutor boundedCalls;
    private final Duration toolTimeout;

    public ToolDispatcher(ToolCatalog catalog,
                          ToolBindings bindings,
                          ToolResultCache cache,
                          BoundedCallExecutor boundedCalls,
                          @Value("${casepilot.tools.timeout:10s}") Duration toolTimeout) {
        this.catalog = catalog;
        this.bindings = bindings;
        this.cache = cache;
        this.boundedCalls = boundedCalls;
        this.toolTimeout = toolTimeout;
    }

    public ToolOutcome dispatch(String toolName, JsonNode args, int turn) {
        String argsDigest = ArgsDigest.of(args, ArgsDigest.RECORD_LENGTH);

        Optional<ToolCatalogEntry> declared = catalog.find(toolName);
        if (declared.isEmpty()) {
            log.warn("[ToolDispatcher] Unknown tool requested: {}", toolName);
            return errorOutcome(turn, toolName, argsDigest, 0.0, "Unknown tool: " + toolName);
        }
        ToolCatalogEntry entry = declared.get();

        // ── cache ────────────────────────────────────────────────────────────
        String key = ArgsDigest.cacheKey(toolName, args);
        long lookupStart = System.nanoTime();
        Optional<JsonNode> cached = cache.get(key);
        if (cached.isPresent()) {
            double latencyMs = elapsedMs(lookupStart);
            JsonNode payload = cached.get();
            ToolCallRecord record = new ToolCallRecord(turn, toolName, argsDigest, latencyMs, true, false,
                    ToolResultSummarizer.summarise(toolName, payload));
            log.debug("[ToolDispatcher] {} served from cache ({} ms)", toolName, String.format("%.3f", latencyMs));
            return new ToolOutcome(record, payload.toString());
        }

        // ── collaborator ─────────────────────────────────────────────────────
        Optional<ToolCollaborator> collaborator = bindings.forTool(toolName);
        if (collaborator.isEmpty()) {
            return fail(entry, turn, argsDigest, 0.0, "No collaborator bound for tool " + toolName, null);
        }

        long invokeStart = System.nanoTime();
        ToolResult result;
        try {
            result = boundedCalls.call(() -> collaborator.get().invoke(args), toolTimeout);
        } catch (TimeoutException e) {
            return fail(entry, turn, argsDigest, elapsedMs(invokeStart),
                    "Tool timed out after " + toolTimeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return fail(entry, turn, argsDigest, elapsedMs(invokeStart),
                    "Tool execution error: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            return fail(entry, turn, argsDigest, elapsedMs(invokeStart), "Tool call interrupted", e);
        }
        double latencyMs = elapsedMs(invokeStart);

        if (result == null) {
            return fail(entry, turn, argsDigest, latencyMs, "Tool returned null result", null);
        }
        if (result.isError()) {
            return fail(entry, turn, argsDigest, latencyMs, result.getError(), null);
        }

        cache.put(key, result.getPayload(), entry.getToolClass());

        ToolCallRecord record = new ToolCallRecord(turn, toolName, argsDigest, latencyMs, false, false,
                ToolResultSummarizer.summarise(toolName, result.getPayload()));
        log.debug("[ToolDispatcher] {} executed ({} ms): {}", toolName, String.format("%.1f", latencyMs),
                record.getResultSummary());
        return new ToolOutcome(record, result.getPayload().toString());
    }

    // =========================================================================
    // Failure handling
    // =========================================================================

    private ToolOutcome fail(ToolCatalogEntry entry, int turn, String argsDigest,
                             double latencyMs, String message, Throwable cause) {
        ToolOutcome outcome = errorOutcome(turn, entry.getName(), argsDigest, latencyMs, message);
        if (!entry.isRecoverable()) {
            log.error("[ToolDispatcher] Non-recoverable tool {} failed: {}", entry.getName(), message);
            throw new ToolDispatchException(
                    "Non-recoverable tool '" + entry.getName() + "' failed: " + message,
                    outcome.getRecord(), cause);
        }
        log.warn("[ToolDispatcher] Tool {} failed (recoverable): {}", entry.getName(), message);
        return outcome;
    }

    private ToolOutcome errorOutcome(int turn, String toolName, String argsDigest,
                                     double latencyMs, String message) {
        ToolCallRecord record = new ToolCallRecord(turn, toolName, argsDigest, latencyMs, false, true,
                ToolResultSummarizer.error(message));
        String content = "{\"error\": " + quote(message) + "}";
        return new ToolOutcome(record, content);
    }

    private static String quote(String message) {
        return TextNode.valueOf(message != null ? message : "").toString();
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
