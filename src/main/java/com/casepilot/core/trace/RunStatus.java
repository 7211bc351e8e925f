package com.casepilot.core.trace;

public enum RunStatus {
    RUNNING,
    COMPLETED,
    ESCALATED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
