package com.casepilot.core.state;

public enum TurnRole {
    USER,
    ASSISTANT,
    TOOL_RESULT
}
