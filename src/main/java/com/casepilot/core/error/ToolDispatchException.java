package com.casepilot.core.error;

import com.casepilot.core.tool.ToolCallRecord;

/**
 * Raised by the dispatcher only for tools declared non-recoverable.
 * Carries the error record so the orchestrator can keep it in the audit trail.
 */
public class ToolDispatchException extends RuntimeException {

    private final ToolCallRecord record;

    public ToolDispatchException(String message, ToolCallRecord record, Throwable cause) {
        super(message, cause);
        this.record = record;
    }

    public ToolCallRecord getRecord() {
        return record;
    }
}
