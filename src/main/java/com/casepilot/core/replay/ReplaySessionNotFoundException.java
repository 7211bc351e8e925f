package com.casepilot.core.replay;

public class ReplaySessionNotFoundException extends RuntimeException {

    public ReplaySessionNotFoundException(String sessionId) {
        super("Replay session '" + sessionId + "' not found.");
    }
}
