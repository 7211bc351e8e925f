package com.casepilot.core.replay;

import com.casepilot.core.terminal.ResolutionType;
import com.casepilot.core.terminal.StructuredOutput;
import com.casepilot.core.trace.RunStatus;
import com.casepilot.core.trace.RunTrace;

import java.util.UUID;

/**
 * One replay child: the paraphrase it ran on, its own trace, and whether its verdict
 * matched the source verdict (same resolution type and same escalate decision).
 */
public final class ReplayRun {

    private final String runId;
    private final int index;
    private final String perturbation;
    private final RunTrace trace;                  // null when the child never started
    private final ResolutionType resolutionType;   // null without a verdict
    private final Double confidenceScore;
    private final Boolean escalate;
    private final boolean matchesOriginal;
    private final String errorMessage;

    private ReplayRun(int index, String perturbation, RunTrace trace, ResolutionType resolutionType,
                      Double confidenceScore, Boolean escalate, boolean matchesOriginal, String errorMessage) {
        this.runId = UUID.randomUUID().toString();
        this.index = index;
        this.perturbation = perturbation;
        this.trace = trace;
        this.resolutionType = resolutionType;
        this.confidenceScore = confidenceScore;
        this.escalate = escalate;
        this.matchesOriginal = matchesOriginal;
        this.errorMessage = errorMessage;
    }

    /**
     * A child that ran to a terminal trace. A FAILED child never matches.
     */
    public static ReplayRun completed(int index, String perturbation, RunTrace trace,
                                      ResolutionType originalType, boolean originalEscalate) {
        StructuredOutput output = trace.getOutput();
        if (trace.getStatus() == RunStatus.FAILED || output == null) {
            return new ReplayRun(index, perturbation, trace, null, null, null, false, trace.getErrorMessage());
        }
        boolean matches = output.getResolutionType() == originalType && output.isEscalate() == originalEscalate;
        return new ReplayRun(index, perturbation, trace, output.getResolutionType(),
                output.getConfidenceScore(), output.isEscalate(), matches, null);
    }

    public static ReplayRun notStarted(int index, String perturbation, String errorMessage) {
        return new ReplayRun(index, perturbation, null, null, null, null, false, errorMessage);
    }

    public String getRunId() {
        return runId;
    }

    public int getIndex() {
        return index;
    }

    public String getPerturbation() {
        return perturbation;
    }

    public RunTrace getTrace() {
        return trace;
    }

    public ResolutionType getResolutionType() {
        return resolutionType;
    }

    public Double getConfidenceScore() {
        return confidenceScore;
    }

    public Boolean getEscalate() {
        return escalate;
    }

    public boolean isMatchesOriginal() {
        return matchesOriginal;
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}
