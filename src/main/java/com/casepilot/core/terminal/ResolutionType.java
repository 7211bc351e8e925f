package com.casepilot.core.terminal;

import java.util.Optional;

public enum ResolutionType {
    AUTO_RESOLVED,
    ESCALATED,
    REFUNDED,
    CORRECTED;

    public static Optional<ResolutionType> parse(String value) {
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
