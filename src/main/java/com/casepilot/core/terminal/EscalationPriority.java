package com.casepilot.core.terminal;

import java.util.Optional;

public enum EscalationPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static Optional<EscalationPriority> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
