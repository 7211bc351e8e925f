package com.casepilot.core.trace;

/**
 * Input/output token totals. Immutable; accumulate with {@link #plus}.
 */
public final class TokenUsage {

    public static final TokenUsage ZERO = new TokenUsage(0, 0);

    private final long inputTokens;
    private final long outputTokens;

    public TokenUsage(long inputTokens, long outputTokens) {
        this.inputTokens = inputTokens;
        this.outputTokens = outputTokens;
    }

    public TokenUsage plus(long input, long output) {
        return new TokenUsage(inputTokens + Math.max(0, input), outputTokens + Math.max(0, output));
    }

    public long getInputTokens() {
        return inputTokens;
    }

    public long getOutputTokens() {
        return outputTokens;
    }

    public long getTotalTokens() {
        return inputTokens + outputTokens;
    }

    @Override
    public String toString() {
        return "TokenUsage{in=" + inputTokens + ", out=" + outputTokens + "}";
    }
}
