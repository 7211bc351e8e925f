package com.casepilot.core.policy;

import com.casepilot.core.terminal.EscalationPriority;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Aggregate of every rule that fired against one verdict.
 */
public final class PolicyEvaluation {

    private final Set<String> flags;
    private final boolean forceEscalation;
    private final EscalationPriority priority;  // highest priority among escalating rules, may be null
    private final List<RuleOutcome> fired;

    PolicyEvaluation(Set<String> flags, boolean forceEscalation,
                     EscalationPriority priority, List<RuleOutcome> fired) {
        this.flags = Collections.unmodifiableSet(new LinkedHashSet<>(flags));
        this.forceEscalation = forceEscalation;
        this.priority = priority;
        this.fired = List.copyOf(fired);
    }

    public Set<String> getFlags() {
        return flags;
    }

    public boolean isForceEscalation() {
        return forceEscalation;
    }

    public EscalationPriority getPriority() {
        return priority;
    }

    public List<RuleOutcome> getFired() {
        return fired;
    }

    public boolean isEmpty() {
        return fired.isEmpty();
    }
}
