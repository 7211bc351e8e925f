package com.casepilot.core.error;

/**
 * Transport or model failure from the completion capability, timeouts included.
 */
public class CompletionCapabilityException extends RuntimeException {

    public CompletionCapabilityException(String message) {
        super(message);
    }

    public CompletionCapabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
