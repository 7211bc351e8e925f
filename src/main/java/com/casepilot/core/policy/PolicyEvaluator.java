package com.casepilot.core.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.casepilot.core.terminal.EscalationPriority;
import com.casepilot.core.terminal.ResolutionType;
import com.casepilot.core.terminal.StructuredOutput;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Deterministic policy check over a captured verdict.
 *
 * Applying a policy only ever adds: flags are merged, escalation can be switched on
 * but never off, and an existing priority is never lowered or replaced.
 */
@Component
public class PolicyEvaluator {

    private static final Logger log = LoggerFactory.getLogger(PolicyEvaluator.class);

    private static final String RULES_RESOURCE = "policy-rules.json";

    private final PolicyRuleTable rules;
    private final double confidenceThreshold;

    @Autowired
    public PolicyEvaluator(ObjectMapper objectMapper,
                           @Value("${casepilot.policy.confidence-threshold:0.6}") double confidenceThreshold) {
        this(loadRules(objectMapper), confidenceThreshold);
    }

    public PolicyEvaluator(PolicyRuleTable rules, double confidenceThreshold) {
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("confidence threshold must lie in [0,1]: " + confidenceThreshold);
        }
        this.rules = rules;
        this.confidenceThreshold = confidenceThreshold;
        log.info("[Policy] {} rule(s) loaded, confidence threshold {}", rules.size(), confidenceThreshold);
    }

    public PolicyEvaluation evaluate(StructuredOutput output) {
        Set<String> flags = new LinkedHashSet<>();
        List<RuleOutcome> fired = new ArrayList<>();
        boolean forceEscalation = false;
        EscalationPriority priority = null;

        for (PolicyRule rule : rules.getRules()) {
            RuleOutcome outcome = rule.evaluate(output, confidenceThreshold).orElse(null);
            if (outcome == null) {
                continue;
            }
            fired.add(outcome);
            flags.add(outcome.getFlag());
            if (outcome.isForceEscalation()) {
                forceEscalation = true;
                priority = higher(priority, outcome.getPriority());
            }
            log.info("[Policy] Rule '{}' fired: {} -> {}", outcome.getRuleId(), outcome.getReason(), outcome.getFlag());
        }
        return new PolicyEvaluation(flags, forceEscalation, priority, fired);
    }

    /**
     * Returns the verdict with the evaluation applied. When escalation is forced on an
     * AUTO_RESOLVED verdict the resolution type becomes ESCALATED.
     */
    public StructuredOutput apply(StructuredOutput output) {
        PolicyEvaluation evaluation = evaluate(output);
        if (evaluation.isEmpty()) {
            return output;
        }

        StructuredOutput.Builder builder = output.toBuilder().policyFlags(evaluation.getFlags());
        if (evaluation.isForceEscalation()) {
            builder.escalate(true);
            if (output.getResolutionType() == ResolutionType.AUTO_RESOLVED) {
                builder.resolutionType(ResolutionType.ESCALATED);
            }
            if (output.getEscalationPriority() == null && evaluation.getPriority() != null) {
                builder.escalationPriority(evaluation.getPriority());
            }
        }
        StructuredOutput applied = builder.build();

        if (applied.isEscalate() != output.isEscalate()
                || applied.getResolutionType() != output.getResolutionType()) {
            log.warn("[Policy] Verdict overridden: {} escalate={} -> {} escalate={}",
                    output.getResolutionType(), output.isEscalate(),
                    applied.getResolutionType(), applied.isEscalate());
        }
        return applied;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    private static EscalationPriority higher(EscalationPriority a, EscalationPriority b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    private static PolicyRuleTable loadRules(ObjectMapper mapper) {
        try (InputStream in = PolicyEvaluator.class.getClassLoader().getResourceAsStream(RULES_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RULES_RESOURCE);
            }
            return PolicyRuleTable.fromJson(mapper, in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RULES_RESOURCE, e);
        }
    }
}
