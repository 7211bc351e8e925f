package com.casepilot.core.issue;

public enum UrgencyTier {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static UrgencyTier parse(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        return valueOf(value.trim().toUpperCase());
    }
}
