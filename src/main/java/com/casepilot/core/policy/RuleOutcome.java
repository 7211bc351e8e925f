package com.casepilot.core.policy;

import com.casepilot.core.terminal.EscalationPriority;

/**
 * What a fired rule asks for: a flag, whether escalation is forced, and the priority
 * to use if the verdict has none.
 */
public final class RuleOutcome {

    private final String ruleId;
    private final String flag;
    private final boolean forceEscalation;
    private final EscalationPriority priority;
    private final String reason;

    public RuleOutcome(String ruleId, String flag, boolean forceEscalation,
                       EscalationPriority priority, String reason) {
        this.ruleId = ruleId;
        this.flag = flag;
        this.forceEscalation = forceEscalation;
        this.priority = priority;
        this.reason = reason;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getFlag() {
        return flag;
    }

    public boolean isForceEscalation() {
        return forceEscalation;
    }

    public EscalationPriority getPriority() {
        return priority;
    }

    public String getReason() {
        return reason;
    }
}
