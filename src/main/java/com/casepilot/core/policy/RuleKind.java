package com.casepilot.core.policy;

public enum RuleKind {
    /** Fires when any signal term appears in the verdict's classification, narrative or flags. */
    SIGNAL,
    /** Fires when confidence is below the threshold for a given resolution type. */
    CONFIDENCE_FLOOR
}
