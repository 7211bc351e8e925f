package com.casepilot.core.issue;

public enum IssueStatus {
    OPEN,
    INVESTIGATING,
    RESOLVED,
    ESCALATED
}
