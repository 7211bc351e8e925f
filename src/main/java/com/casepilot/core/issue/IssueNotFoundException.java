package com.casepilot.core.issue;

public class IssueNotFoundException extends RuntimeException {

    public IssueNotFoundException(String issueId) {
        super("Issue '" + issueId + "' not found.");
    }
}
