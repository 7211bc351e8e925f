package com.casepilot.core.trace;

import org.slf4j.MDC;

import java.util.Map;

/**
 * MDC keys used for log correlation. The log pattern prints {@code %X{traceId}} and
 * {@code %X{replaySession}}.
 */
public final class TraceContext {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String REPLAY_SESSION_KEY = "replaySession";

    private TraceContext() {}

    /** Binds the trace id to the current thread until the returned handle is closed. */
    public static MDC.MDCCloseable bind(String traceId) {
        return MDC.putCloseable(TRACE_ID_KEY, traceId);
    }

    public static MDC.MDCCloseable bindReplaySession(String sessionId) {
        return MDC.putCloseable(REPLAY_SESSION_KEY, sessionId);
    }

    /**
     * Captures the caller's MDC now and applies it while {@code task} runs on another
     * thread. The worker's own MDC is restored afterwards.
     */
    public static Runnable propagate(Runnable task) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            apply(captured);
            try {
                task.run();
            } finally {
                apply(previous);
            }
        };
    }

    private static void apply(Map<String, String> context) {
        if (context == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
    }
}
