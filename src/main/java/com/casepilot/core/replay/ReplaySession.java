package com.casepilot.core.replay;

import com.casepilot.core.terminal.ResolutionType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * A stability check of one source trace: N children, appended as they finish.
 *
 * stabilityScore = matches / nRuns, and only once the session is COMPLETED, which
 * requires every child to have been recorded.
 */
public class ReplaySession {

    private final String sessionId;
    private final String sourceTraceId;
    private final String issueId;
    private final int nRuns;
    private final Long seed;
    private final ResolutionType originalResolutionType;
    private final boolean originalEscalate;
    private final Instant startedAt;

    private ReplayStatus status = ReplayStatus.RUNNING;
    private Instant completedAt;
    private int matches;
    private String errorMessage;
    private final List<ReplayRun> runs = new ArrayList<>();

    public ReplaySession(String sourceTraceId, String issueId, int nRuns, Long seed,
                         ResolutionType originalResolutionType, boolean originalEscalate, Instant startedAt) {
        if (nRuns < 1) {
            throw new IllegalArgumentException("nRuns must be at least 1: " + nRuns);
        }
        this.sessionId = UUID.randomUUID().toString();
        this.sourceTraceId = sourceTraceId;
        this.issueId = issueId;
        this.nRuns = nRuns;
        this.seed = seed;
        this.originalResolutionType = originalResolutionType;
        this.originalEscalate = originalEscalate;
        this.startedAt = startedAt;
    }

    /**
     * @return false if the session has already left RUNNING or is full; the run is dropped
     */
    public synchronized boolean recordRun(ReplayRun run) {
        if (status != ReplayStatus.RUNNING || runs.size() >= nRuns) {
            return false;
        }
        runs.add(run);
        if (run.isMatchesOriginal()) {
            matches++;
        }
        return true;
    }

    public synchronized void complete(Instant now) {
        requireRunning();
        if (runs.size() != nRuns) {
            throw new IllegalStateException("Session " + sessionId + " has " + runs.size()
                    + " of " + nRuns + " runs; cannot complete");
        }
        status = ReplayStatus.COMPLETED;
        completedAt = now;
    }

    public synchronized void fail(String message, Instant now) {
        requireRunning();
        status = ReplayStatus.FAILED;
        errorMessage = message;
        completedAt = now;
    }

    private void requireRunning() {
        if (status != ReplayStatus.RUNNING) {
            throw new IllegalStateException("Session " + sessionId + " is already " + status);
        }
    }

    public synchronized OptionalDouble getStabilityScore() {
        if (status != ReplayStatus.COMPLETED) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((double) matches / nRuns);
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getSourceTraceId() {
        return sourceTraceId;
    }

    public String getIssueId() {
        return issueId;
    }

    @JsonProperty("n_runs")
    public int getNRuns() {
        return nRuns;
    }

    public Long getSeed() {
        return seed;
    }

    public ResolutionType getOriginalResolutionType() {
        return originalResolutionType;
    }

    public boolean isOriginalEscalate() {
        return originalEscalate;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public synchronized ReplayStatus getStatus() {
        return status;
    }

    public synchronized Instant getCompletedAt() {
        return completedAt;
    }

    public synchronized int getMatches() {
        return matches;
    }

    public synchronized String getErrorMessage() {
        return errorMessage;
    }

    public synchronized List<ReplayRun> getRuns() {
        return List.copyOf(runs);
    }

    @Override
    public synchronized String toString() {
        return "ReplaySession{" + sessionId + ", source=" + sourceTraceId + ", status=" + status
                + ", runs=" + runs.size() + "/" + nRuns + ", matches=" + matches + "}";
    }
}
