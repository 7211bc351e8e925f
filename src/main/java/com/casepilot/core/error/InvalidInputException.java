package com.casepilot.core.error;

/**
 * Bad issue data, rejected before an investigation loop starts.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }
}
