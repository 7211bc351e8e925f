package com.casepilot.core.policy;

import com.casepilot.core.terminal.EscalationPriority;
import com.casepilot.core.terminal.ResolutionType;
import com.casepilot.core.terminal.StructuredOutput;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One row of the policy rule table. Rows are data (see policy-rules.json); the two
 * {@link RuleKind}s are the only behaviours.
 *
 * SIGNAL terms match whole tokens. Issue type and policy flags are codes and match
 * as-is; in root cause and resolution text a match preceded by a negation within
 * the same clause ("no indication of fraud") is ignored.
 */
public final class PolicyRule {

    private static final Set<String> NEGATIONS = Set.of("NO", "NOT", "NEVER", "WITHOUT", "NONE", "NOR");
    private static final int NEGATION_WINDOW = 4;
    private static final Pattern CLAUSE_BREAK = Pattern.compile("[.;:,!?()]+|\\bbut\\b", Pattern.CASE_INSENSITIVE);

    private final String id;
    private final RuleKind kind;
    private final List<String> signals;          // SIGNAL
    private final ResolutionType resolutionType; // CONFIDENCE_FLOOR
    private final String flag;
    private final boolean escalate;
    private final EscalationPriority priority;

    public PolicyRule(String id,
                      RuleKind kind,
                      List<String> signals,
                      ResolutionType resolutionType,
                      String flag,
                      boolean escalate,
                      EscalationPriority priority) {
        this.id = id;
        this.kind = kind;
        this.signals = normaliseAll(signals);
        this.resolutionType = resolutionType;
        this.flag = flag;
        this.escalate = escalate;
        this.priority = priority;
    }

    /**
     * @param confidenceThreshold used by CONFIDENCE_FLOOR rows only
     */
    public Optional<RuleOutcome> evaluate(StructuredOutput output, double confidenceThreshold) {
        return switch (kind) {
            case SIGNAL -> matchSignal(output)
                    .map(signal -> new RuleOutcome(id, flag, escalate, priority, "signal " + signal));
            case CONFIDENCE_FLOOR -> {
                boolean typeMatches = resolutionType == null || output.getResolutionType() == resolutionType;
                if (typeMatches && output.getConfidenceScore() < confidenceThreshold) {
                    yield Optional.of(new RuleOutcome(id, flag, escalate, priority,
                            "confidence " + output.getConfidenceScore() + " < " + confidenceThreshold
                                    + " with " + output.getResolutionType()));
                }
                yield Optional.empty();
            }
        };
    }

    private Optional<String> matchSignal(StructuredOutput output) {
        List<String> codes = new ArrayList<>();
        codes.add(normalise(output.getIssueType()));
        output.getPolicyFlags().forEach(f -> codes.add(normalise(f)));

        List<String> clauses = new ArrayList<>();
        clauses.addAll(clausesOf(output.getRootCause()));
        clauses.addAll(clausesOf(output.getResolution()));

        for (String signal : signals) {
            for (String code : codes) {
                if (containsToken(code, signal)) {
                    return Optional.of(signal);
                }
            }
            for (String clause : clauses) {
                if (containsAffirmed(clause, signal)) {
                    return Optional.of(signal);
                }
            }
        }
        return Optional.empty();
    }

    // "Suspicious login" and SUSPICIOUS_LOGIN compare equal
    static String normalise(String text) {
        if (text == null) return "";
        return text.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]+", "_").replaceAll("^_+|_+$", "");
    }

    private static List<String> clausesOf(String text) {
        List<String> out = new ArrayList<>();
        if (text == null) return out;
        for (String clause : CLAUSE_BREAK.split(text)) {
            String n = normalise(clause);
            if (!n.isEmpty()) out.add(n);
        }
        return out;
    }

    private static boolean containsToken(String text, String signal) {
        return ("_" + text + "_").contains("_" + signal + "_");
    }

    // true when some occurrence of the signal is not negated earlier in the same clause
    private static boolean containsAffirmed(String clause, String signal) {
        String padded = "_" + clause + "_";
        String needle = "_" + signal + "_";
        int at = padded.indexOf(needle);
        while (at >= 0) {
            String[] before = padded.substring(0, at).split("_");
            boolean negated = false;
            for (int i = Math.max(0, before.length - NEGATION_WINDOW); i < before.length; i++) {
                if (NEGATIONS.contains(before[i])) {
                    negated = true;
                    break;
                }
            }
            if (!negated) {
                return true;
            }
            at = padded.indexOf(needle, at + 1);
        }
        return false;
    }

    private static List<String> normaliseAll(List<String> values) {
        List<String> out = new ArrayList<>();
        if (values != null) {
            for (String v : values) {
                String n = normalise(v);
                if (!n.isEmpty()) out.add(n);
            }
        }
        return List.copyOf(out);
    }

    public String getId() {
        return id;
    }

    public RuleKind getKind() {
        return kind;
    }

    public String getFlag() {
        return flag;
    }
}
