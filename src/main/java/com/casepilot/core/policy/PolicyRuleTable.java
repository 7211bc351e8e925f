package com.casepilot.core.policy;

import com.casepilot.core.terminal.EscalationPriority;
import com.casepilot.core.terminal.ResolutionType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered policy rules, read from a document of the form
 * {"rules": [{id, kind, signals, resolution_type, flag, escalate, priority}]}.
 */
public final class PolicyRuleTable {

    private final List<PolicyRule> rules;

    public PolicyRuleTable(List<PolicyRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static PolicyRuleTable fromJson(ObjectMapper mapper, InputStream in) throws IOException {
        JsonNode root = mapper.readTree(in);
        JsonNode rows = root.path("rules");
        if (!rows.isArray()) {
            throw new IOException("Policy rule document has no 'rules' array");
        }

        List<PolicyRule> rules = new ArrayList<>();
        for (JsonNode row : rows) {
            String id = row.path("id").asText("");
            String flag = row.path("flag").asText("");
            if (id.isBlank() || flag.isBlank()) {
                throw new IOException("Policy rule needs both 'id' and 'flag': " + row);
            }

            RuleKind kind;
            try {
                kind = RuleKind.valueOf(row.path("kind").asText("SIGNAL").toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new IOException("Unknown policy rule kind in rule " + id, e);
            }

            List<String> signals = new ArrayList<>();
            row.path("signals").forEach(s -> signals.add(s.asText()));
            if (kind == RuleKind.SIGNAL && signals.isEmpty()) {
                throw new IOException("SIGNAL rule " + id + " declares no signals");
            }

            ResolutionType resolutionType = row.hasNonNull("resolution_type")
                    ? ResolutionType.parse(row.get("resolution_type").asText())
                        .orElseThrow(() -> new IOException("Bad resolution_type in rule " + id))
                    : null;
            EscalationPriority priority = row.hasNonNull("priority")
                    ? EscalationPriority.parse(row.get("priority").asText())
                        .orElseThrow(() -> new IOException("Bad priority in rule " + id))
                    : null;

            rules.add(new PolicyRule(id, kind, signals, resolutionType,
                    flag.trim().toUpperCase(), row.path("escalate").asBoolean(false), priority));
        }
        return new PolicyRuleTable(rules);
    }

    public List<PolicyRule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }
}
