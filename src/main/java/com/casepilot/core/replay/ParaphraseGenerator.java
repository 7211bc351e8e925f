package com.casepilot.core.replay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.casepilot.core.agent.AgentType;
import com.casepilot.core.executor.BoundedCallExecutor;
import com.casepilot.llm.LLMClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Produces reworded variants of a customer message for stability checks.
 *
 * One completion per variant, each asked for a different style. When a completion fails
 * or comes back empty, that slot falls back to a fixed rule-based variant. With a seed,
 * style choice and fallback order come from a seeded Random and sampling temperature is 0.
 */
@Component
public class ParaphraseGenerator {

    private static final Logger log = LoggerFactory.getLogger(ParaphraseGenerator.class);

    static final List<String> STYLES = List.of(
            "formal and brief",
            "casual and brief",
            "formal and detailed",
            "casual and detailed",
            "calm",
            "frustrated",
            "polite but urgent",
            "terse");

    static final List<String> FALLBACK_TEMPLATES = List.of(
            "Hi support team, I need help with the following: %s",
            "To whom it may concern, %s Please advise on next steps.",
            "Hello, I'm reaching out regarding an issue. %s Appreciate your assistance.",
            "I wanted to follow up on this matter urgently. %s",
            "Good day. I have a concern I need resolved: %s Thank you.");

    private final LLMClient llmClient;
    private final BoundedCallExecutor boundedCalls;
    private final Duration llmTimeout;

    public ParaphraseGenerator(LLMClient llmClient,
                               BoundedCallExecutor boundedCalls,
                               @Value("${casepilot.llm.timeout:60s}") Duration llmTimeout) {
        this.llmClient = llmClient;
        this.boundedCalls = boundedCalls;
        this.llmTimeout = llmTimeout;
    }

    /**
     * @param seed optional; same seed and same model behaviour give the same variants
     * @return exactly {@code n} non-blank variants
     */
    public List<String> generate(String message, int n, Long seed) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be at least 1: " + n);
        }
        Random random = seed != null ? new Random(seed) : new Random();
        double temperature = seed != null ? 0.0 : llmClient.getTemperatureForRole(AgentType.PARAPHRASER);

        List<String> fallbacks = new ArrayList<>(FALLBACK_TEMPLATES);
        if (seed != null) {
            Collections.shuffle(fallbacks, random);
        }

        List<String> variants = new ArrayList<>(n);
        int fallbackCount = 0;
        for (int i = 0; i < n; i++) {
            String style = STYLES.get(random.nextInt(STYLES.size()));
            String variant = requestParaphrase(message, style, temperature);
            if (variant == null) {
                variant = fallbacks.get(i % fallbacks.size()).formatted(message);
                fallbackCount++;
            }
            variants.add(variant);
        }

        log.info("[Paraphrase] {} variant(s) generated, {} from rule-based fallback", n, fallbackCount);
        return variants;
    }

    private String requestParaphrase(String message, String style, double temperature) {
        String prompt = """
                Rewrite this customer support message in a %s style.
                Rules:
                - Keep ALL factual details identical: amounts, dates, account types, names, transaction IDs
                - Vary only wording, sentence structure and tone
                - Return only the rewritten message, no preamble

                Original message:
                <<<
                %s
                >>>
                """.formatted(style, message);
        try {
            String raw = boundedCalls.call(
                    () -> llmClient.generateWithRole(AgentType.PARAPHRASER, prompt, temperature),
                    llmTimeout);
            String cleaned = clean(raw);
            if (cleaned.isEmpty()) {
                log.warn("[Paraphrase] Empty paraphrase ({} style); using fallback", style);
                return null;
            }
            return cleaned;
        } catch (Exception e) {
            log.warn("[Paraphrase] Paraphrase request failed ({} style): {}; using fallback", style, e.toString());
            return null;
        }
    }

    static String clean(String raw) {
        if (raw == null) return "";
        String text = raw.trim();
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            text = text.substring(1, text.length() - 1).trim();
        }
        return text;
    }
}
