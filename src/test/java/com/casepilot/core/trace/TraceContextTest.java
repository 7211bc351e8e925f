package com.casepilot.core.trace;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TraceContextTest {

    private final ExecutorService worker = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        MDC.clear();
        worker.shutdownNow();
    }

    @Test
    void testBindIsUndoneOnClose() {
        try (MDC.MDCCloseable ignored = TraceContext.bind("trace-1")) {
            assertEquals("trace-1", MDC.get(TraceContext.TRACE_ID_KEY));
        }
        assertNull(MDC.get(TraceContext.TRACE_ID_KEY));
    }

    @Test
    void testPropagateCarriesCallerContextAndRestoresWorker() throws Exception {
        worker.submit(() -> MDC.put("worker", "own")).get(5, TimeUnit.SECONDS);

        AtomicReference<String> seenSession = new AtomicReference<>();
        AtomicReference<String> seenWorkerKey = new AtomicReference<>();
        Runnable task;
        try (MDC.MDCCloseable ignored = TraceContext.bindReplaySession("rs-1")) {
            task = TraceContext.propagate(() -> {
                seenSession.set(MDC.get(TraceContext.REPLAY_SESSION_KEY));
                seenWorkerKey.set(MDC.get("worker"));
            });
        }
        worker.submit(task).get(5, TimeUnit.SECONDS);

        assertEquals("rs-1", seenSession.get());
        assertNull(seenWorkerKey.get(), "task sees the caller's context, not the worker's");

        AtomicReference<String> after = new AtomicReference<>();
        worker.submit(() -> {
            after.set(MDC.get("worker") + "/" + MDC.get(TraceContext.REPLAY_SESSION_KEY));
        }).get(5, TimeUnit.SECONDS);
        assertEquals("own/null", after.get());
    }
}
