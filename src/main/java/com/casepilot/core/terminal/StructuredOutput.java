package com.casepilot.core.terminal;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Final verdict of an investigation, captured from the terminal tool's payload
 * (or synthesised when the turn budget runs out).
 *
 * Immutable. Fields outside the fixed set are kept in {@link #getExtras()} untouched.
 */
public final class StructuredOutput {

    private final String issueType;
    private final String rootCause;
    private final String resolution;
    private final ResolutionType resolutionType;
    private final List<String> nextSteps;
    private final double confidenceScore;
    private final boolean escalate;
    private final EscalationPriority escalationPriority;  // null when not given
    private final Set<String> policyFlags;
    private final Map<String, JsonNode> extras;

    private StructuredOutput(Builder b) {
        this.issueType = b.issueType != null ? b.issueType : "GENERAL";
        this.rootCause = b.rootCause != null ? b.rootCause : "";
        this.resolution = b.resolution != null ? b.resolution : "";
        this.resolutionType = b.resolutionType;
        this.nextSteps = List.copyOf(b.nextSteps);
        this.confidenceScore = b.confidenceScore;
        this.escalate = b.escalate;
        this.escalationPriority = b.escalationPriority;
        this.policyFlags = Collections.unmodifiableSet(new LinkedHashSet<>(b.policyFlags));
        this.extras = Collections.unmodifiableMap(new LinkedHashMap<>(b.extras));
    }

    public static Builder builder(ResolutionType resolutionType, double confidenceScore, boolean escalate) {
        return new Builder(resolutionType, confidenceScore, escalate);
    }

    public Builder toBuilder() {
        Builder b = new Builder(resolutionType, confidenceScore, escalate)
                .issueType(issueType)
                .rootCause(rootCause)
                .resolution(resolution)
                .escalationPriority(escalationPriority);
        b.nextSteps.addAll(nextSteps);
        b.policyFlags.addAll(policyFlags);
        b.extras.putAll(extras);
        return b;
    }

    public String getIssueType() {
        return issueType;
    }

    public String getRootCause() {
        return rootCause;
    }

    public String getResolution() {
        return resolution;
    }

    public ResolutionType getResolutionType() {
        return resolutionType;
    }

    public List<String> getNextSteps() {
        return nextSteps;
    }

    public double getConfidenceScore() {
        return confidenceScore;
    }

    public boolean isEscalate() {
        return escalate;
    }

    public EscalationPriority getEscalationPriority() {
        return escalationPriority;
    }

    public Set<String> getPolicyFlags() {
        return policyFlags;
    }

    public boolean hasFlag(String flag) {
        return policyFlags.contains(flag);
    }

    public Map<String, JsonNode> getExtras() {
        return extras;
    }

    @Override
    public String toString() {
        return "StructuredOutput{type=" + resolutionType + ", confidence=" + confidenceScore
                + ", escalate=" + escalate + ", flags=" + policyFlags + "}";
    }

    public static final class Builder {

        private ResolutionType resolutionType;
        private double confidenceScore;
        private boolean escalate;
        private String issueType;
        private String rootCause;
        private String resolution;
        private EscalationPriority escalationPriority;
        private final List<String> nextSteps = new ArrayList<>();
        private final Set<String> policyFlags = new LinkedHashSet<>();
        private final Map<String, JsonNode> extras = new LinkedHashMap<>();

        private Builder(ResolutionType resolutionType, double confidenceScore, boolean escalate) {
            this.resolutionType = resolutionType;
            this.confidenceScore = confidenceScore;
            this.escalate = escalate;
        }

        public Builder resolutionType(ResolutionType v) { this.resolutionType = v; return this; }
        public Builder escalate(boolean v)               { this.escalate = v; return this; }
        public Builder issueType(String v)               { this.issueType = v; return this; }
        public Builder rootCause(String v)               { this.rootCause = v; return this; }
        public Builder resolution(String v)              { this.resolution = v; return this; }
        public Builder escalationPriority(EscalationPriority v) { this.escalationPriority = v; return this; }
        public Builder nextStep(String v)                { this.nextSteps.add(v); return this; }
        public Builder policyFlag(String v)              { this.policyFlags.add(v); return this; }
        public Builder extra(String key, JsonNode v)     { this.extras.put(key, v); return this; }

        public Builder policyFlags(Set<String> flags) {
            this.policyFlags.addAll(flags);
            return this;
        }

        public StructuredOutput build() {
            if (resolutionType == null) {
                throw new IllegalStateException("resolutionType is required");
            }
            if (Double.isNaN(confidenceScore) || confidenceScore < 0.0 || confidenceScore > 1.0) {
                throw new IllegalStateException("confidenceScore must lie in [0,1]: " + confidenceScore);
            }
            return new StructuredOutput(this);
        }
    }
}
