package com.casepilot.core.replay;

public enum ReplayStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
