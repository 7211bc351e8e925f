package com.casepilot.core.tool;

/**
 * One dispatched (or cache-served) tool invocation, as kept in the audit trail.
 *
 * Holds a digest of the arguments instead of the arguments themselves.
 */
public final class ToolCallRecord {

    private final int turn;
    private final String tool;
    private final String argsDigest;
    private final double latencyMs;
    private final boolean cacheHit;
    private final boolean error;
    private final String resultSummary;

    public ToolCallRecord(int turn,
                          String tool,
                          String argsDigest,
                          double latencyMs,
                          boolean cacheHit,
                          boolean error,
                          String resultSummary) {
        this.turn = turn;
        this.tool = tool;
        this.argsDigest = argsDigest;
        this.latencyMs = latencyMs;
        this.cacheHit = cacheHit;
        this.error = error;
        this.resultSummary = resultSummary != null ? resultSummary : "";
    }

    public int getTurn() {
        return turn;
    }

    public String getTool() {
        return tool;
    }

    public String getArgsDigest() {
        return argsDigest;
    }

    public double getLatencyMs() {
        return latencyMs;
    }

    public boolean isCacheHit() {
        return cacheHit;
    }

    public boolean isError() {
        return error;
    }

    public String getResultSummary() {
        return resultSummary;
    }

    @Override
    public String toString() {
        return String.format("ToolCallRecord{turn=%d, tool='%s', digest=%s, latencyMs=%.2f, cacheHit=%b, summary='%s'}",
                turn, tool, argsDigest, latencyMs, cacheHit, resultSummary);
    }
}
