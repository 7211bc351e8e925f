package com.casepilot.orchestrator;

/**
 * How an investigation is run: as the primary investigation of an issue, or as a
 * replay child of an earlier trace. Replay children skip the critic and never touch
 * issue status.
 */
public final class RunOptions {

    private static final RunOptions PRIMARY = new RunOptions(false, null);

    private final boolean replay;
    private final String sourceTraceId;

    private RunOptions(boolean replay, String sourceTraceId) {
        this.replay = replay;
        this.sourceTraceId = sourceTraceId;
    }

    public static RunOptions primary() {
        return PRIMARY;
    }

    public static RunOptions replayOf(String sourceTraceId) {
        return new RunOptions(true, sourceTraceId);
    }

    public boolean isReplay() {
        return replay;
    }

    public String getSourceTraceId() {
        return sourceTraceId;
    }

    public boolean isCriticRequested() {
        return !replay;
    }

    public boolean changesIssueStatus() {
        return !replay;
    }
}
