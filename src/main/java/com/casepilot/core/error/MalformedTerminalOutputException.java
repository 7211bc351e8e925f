package com.casepilot.core.error;

/**
 * The model's terminal payload failed schema validation. The owning run is marked FAILED.
 */
public class MalformedTerminalOutputException extends RuntimeException {

    public MalformedTerminalOutputException(String message) {
        super(message);
    }
}
