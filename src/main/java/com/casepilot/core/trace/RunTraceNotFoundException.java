package com.casepilot.core.trace;

public class RunTraceNotFoundException extends RuntimeException {

    public RunTraceNotFoundException(String traceId) {
        super("RunTrace '" + traceId + "' not found.");
    }
}
