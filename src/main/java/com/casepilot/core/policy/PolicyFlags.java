package com.casepilot.core.policy;

/**
 * Controlled vocabulary of policy flags the engine itself emits or reasons about.
 * The model may report other codes; they are preserved as given (upper-cased).
 */
public final class PolicyFlags {

    public static final String MANDATORY_ESCALATION        = "MANDATORY_ESCALATION";
    public static final String MAX_TURNS_EXCEEDED          = "MAX_TURNS_EXCEEDED";
    public static final String LOW_CONFIDENCE_AUTO_RESOLVE = "LOW_CONFIDENCE_AUTO_RESOLVE";
    public static final String REGULATED_ADVICE            = "REGULATED_ADVICE";
    public static final String AML_REVIEW_TRIGGERED        = "AML_REVIEW_TRIGGERED";

    private PolicyFlags() {
    }
}
