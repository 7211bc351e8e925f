package com.casepilot.core.trace;

import com.casepilot.core.terminal.StructuredOutput;
import com.casepilot.core.tool.ToolCallRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Audit record of one investigation.
 *
 * Created RUNNING and written only by the orchestrator invocation that owns it.
 * Once the status leaves RUNNING every mutator throws {@link IllegalStateException}.
 * Reads are safe from other threads (replay polling, HTTP).
 */
public class RunTrace {

    private final String traceId;
    private final String issueId;
    private final Instant startedAt;
    private final boolean replay;
    private final String sourceTraceId;   // set for replay children only
    private final String model;

    private Instant completedAt;
    private RunStatus status = RunStatus.RUNNING;
    private final List<ToolCallRecord> toolCalls = new ArrayList<>();
    private final List<String> reasoning = new ArrayList<>();
    private StructuredOutput output;
    private TokenUsage tokenUsage = TokenUsage.ZERO;
    private int turnsTaken;
    private String errorMessage;

    private Boolean criticAgrees;
    private String criticNotes;
    private String criticModel;

    private RunTrace(String traceId, String issueId, Instant startedAt,
                     boolean replay, String sourceTraceId, String model) {
        this.traceId = traceId;
        this.issueId = issueId;
        this.startedAt = startedAt;
        this.replay = replay;
        this.sourceTraceId = sourceTraceId;
        this.model = model;
    }

    public static RunTrace start(String issueId, String model, Instant now) {
        return new RunTrace(UUID.randomUUID().toString(), issueId, now, false, null, model);
    }

    public static RunTrace startReplay(String issueId, String sourceTraceId, String model, Instant now) {
        return new RunTrace(UUID.randomUUID().toString(), issueId, now, true, sourceTraceId, model);
    }

    // =========================================================================
    // Mutators (RUNNING only)
    // =========================================================================

    public synchronized void addToolCall(ToolCallRecord record) {
        requireRunning();
        toolCalls.add(record);
    }

    public synchronized void addReasoning(String text) {
        requireRunning();
        if (text != null && !text.isBlank()) {
            reasoning.add(text.trim());
        }
    }

    public synchronized void addTokens(long input, long output) {
        requireRunning();
        tokenUsage = tokenUsage.plus(input, output);
    }

    public synchronized void setTurnsTaken(int turnsTaken) {
        requireRunning();
        this.turnsTaken = turnsTaken;
    }

    public synchronized void recordCritic(boolean agrees, String notes, String model) {
        requireRunning();
        this.criticAgrees = agrees;
        this.criticNotes = notes;
        this.criticModel = model;
    }

    /**
     * Terminal transition with a verdict: ESCALATED when the verdict escalates, COMPLETED otherwise.
     */
    public synchronized void finish(StructuredOutput output, Instant now) {
        requireRunning();
        if (output == null) {
            throw new IllegalArgumentException("A finished trace needs a structured output");
        }
        this.output = output;
        this.status = output.isEscalate() ? RunStatus.ESCALATED : RunStatus.COMPLETED;
        this.completedAt = now;
    }

    /** Terminal transition without a verdict. Captured tool calls are kept. */
    public synchronized void fail(String errorMessage, Instant now) {
        requireRunning();
        this.errorMessage = errorMessage;
        this.status = RunStatus.FAILED;
        this.completedAt = now;
    }

    private void requireRunning() {
        if (status != RunStatus.RUNNING) {
            throw new IllegalStateException("RunTrace " + traceId + " is " + status + " and can no longer change");
        }
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public String getTraceId() {
        return traceId;
    }

    public String getIssueId() {
        return issueId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public boolean isReplay() {
        return replay;
    }

    public String getSourceTraceId() {
        return sourceTraceId;
    }

    public String getModel() {
        return model;
    }

    public synchronized Instant getCompletedAt() {
        return completedAt;
    }

    public synchronized RunStatus getStatus() {
        return status;
    }

    public synchronized List<ToolCallRecord> getToolCalls() {
        return List.copyOf(toolCalls);
    }

    public synchronized List<String> getReasoning() {
        return List.copyOf(reasoning);
    }

    /** Reasoning trail as one block of text. */
    public synchronized String reasoningText() {
        return String.join("\n", reasoning);
    }

    public synchronized StructuredOutput getOutput() {
        return output;
    }

    public synchronized TokenUsage getTokenUsage() {
        return tokenUsage;
    }

    public synchronized int getTurnsTaken() {
        return turnsTaken;
    }

    public synchronized String getErrorMessage() {
        return errorMessage;
    }

    public synchronized Boolean getCriticAgrees() {
        return criticAgrees;
    }

    public synchronized String getCriticNotes() {
        return criticNotes;
    }

    public synchronized String getCriticModel() {
        return criticModel;
    }

    public synchronized Long getDurationMs() {
        return completedAt == null ? null : completedAt.toEpochMilli() - startedAt.toEpochMilli();
    }

    @Override
    public synchronized String toString() {
        return "RunTrace{" + traceId + ", issue=" + issueId + ", status=" + status
                + ", toolCalls=" + toolCalls.size() + ", replay=" + replay + "}";
    }
}
