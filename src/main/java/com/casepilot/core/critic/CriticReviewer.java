package com.casepilot.core.critic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.casepilot.core.agent.AgentType;
import com.casepilot.core.terminal.StructuredOutput;
import com.casepilot.core.trace.RunTrace;
import com.casepilot.llm.LLMClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * CriticReviewer - independent second opinion on a captured verdict.
 *
 * One non-tool completion per review. Never gates the investigation: any failure
 * (transport, empty reply, unparseable JSON) yields {@link CriticVerdict#unavailable}.
 */
@Component
public class CriticReviewer {

    private static final Logger log = LoggerFactory.getLogger(CriticReviewer.class);

    static final int REASONING_EXCERPT_CHARS = 600;

    private final LLMClient llmClient;
    private final ObjectMapper objectMapper;

    public CriticReviewer(LLMClient llmClient, ObjectMapper objectMapper) {
        this.llmClient = llmClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Reviews a finished trace. Its status is not changed.
     */
    public CriticVerdict review(RunTrace trace) {
        if (trace.getOutput() == null) {
            log.warn("[Critic] Trace {} has no verdict to review", trace.getTraceId());
            return CriticVerdict.unavailable(llmClient.modelFor(AgentType.CRITIC));
        }
        return review(trace.getIssueId(), trace.getOutput(), trace.reasoningText());
    }

    /**
     * Reviews a verdict before it is committed to its trace.
     */
    public CriticVerdict review(String issueId, StructuredOutput output, String reasoning) {
        String model = llmClient.modelFor(AgentType.CRITIC);
        String raw = "";
        try {
            String prompt = buildPrompt(issueId, output, reasoning != null ? reasoning : "");
            raw = llmClient.generateWithRole(
                    AgentType.CRITIC,
                    prompt,
                    llmClient.getTemperatureForRole(AgentType.CRITIC));

            JsonNode parsed = objectMapper.readTree(stripFences(raw));
            if (parsed == null || !parsed.isObject()) {
                log.warn("[Critic] Reply is not a JSON object: {}", preview(raw));
                return CriticVerdict.unavailable(model);
            }

            CriticVerdict verdict = new CriticVerdict(
                    parsed.path("agrees").asBoolean(true),
                    parsed.path("note").asText(""),
                    model);
            log.info("[Critic] issue={} agrees={}", issueId, verdict.isAgrees());
            return verdict;

        } catch (Exception e) {
            log.warn("[Critic] Review failed for issue {}: {} (reply: {})",
                    issueId, e.getMessage(), preview(raw));
            return CriticVerdict.unavailable(model);
        }
    }

    // =========================================================================
    // Prompt
    // =========================================================================

    private String buildPrompt(String issueId, StructuredOutput output, String reasoning) throws Exception {
        String excerpt = reasoning.length() > REASONING_EXCERPT_CHARS
                ? reasoning.substring(0, REASONING_EXCERPT_CHARS)
                : reasoning;

        return """
                Review this investigation verdict.

                Check that:
                1. resolution_type fits the stated root_cause
                2. confidence_score is neither inflated nor deflated
                3. the escalation decision is sound (suspected fraud, tax or regulatory advice,
                   over-contributions, AML flags and insufficient data all require escalate=true)
                4. policy_flags cover the described root_cause

                Set agrees=false only for a meaningful concern: wrong resolution type, a clearly
                wrong escalation decision, or a dangerously overconfident score.

                Issue ID: %s

                Verdict:
                %s

                Reasoning (excerpt):
                %s

                Respond with JSON only: {"agrees": true|false, "note": "<one or two sentences>"}
                """.formatted(issueId, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(output)), excerpt);
    }

    private ObjectNode toJson(StructuredOutput output) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("issue_type", output.getIssueType());
        node.put("root_cause", output.getRootCause());
        node.put("resolution", output.getResolution());
        node.put("resolution_type", output.getResolutionType().name());
        node.put("confidence_score", output.getConfidenceScore());
        node.put("escalate", output.isEscalate());
        if (output.getEscalationPriority() != null) {
            node.put("escalation_priority", output.getEscalationPriority().name());
        }
        output.getNextSteps().forEach(node.putArray("next_steps")::add);
        output.getPolicyFlags().forEach(node.putArray("policy_flags")::add);
        return node;
    }

    // =========================================================================
    // Reply parsing
    // =========================================================================

    static String stripFences(String raw) {
        String text = raw == null ? "" : raw.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline >= 0 ? text.substring(firstNewline + 1) : "";
            int closing = text.lastIndexOf("```");
            if (closing >= 0) {
                text = text.substring(0, closing);
            }
        }
        return text.trim();
    }

    private static String preview(String raw) {
        if (raw == null) return "";
        return raw.length() > 120 ? raw.substring(0, 120) + "..." : raw;
    }
}
