package com.casepilot.core.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs blocking collaborator calls (completion requests, tool invocations) under a
 * per-call timeout. A call that overruns is cancelled and surfaces as {@link TimeoutException};
 * callers map that onto their ordinary model-level or tool-level failure path.
 *
 * Calls are handed straight to a thread, never queued, so the timeout covers only the call
 * itself. {@code casepilot.io.threads} is the number of idle threads kept warm, not a cap.
 */
@Component
public class BoundedCallExecutor implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(BoundedCallExecutor.class);

    private static final Duration IDLE_KEEP_ALIVE = Duration.ofSeconds(60);

    private final ExecutorService pool;

    public BoundedCallExecutor(@Value("${casepilot.io.threads:16}") int threads) {
        this.pool = new ThreadPoolExecutor(threads, Integer.MAX_VALUE,
                IDLE_KEEP_ALIVE.toSeconds(), TimeUnit.SECONDS,
                new SynchronousQueue<>(), namedDaemonThreads("casepilot-io-"));
    }

    public <T> T call(Callable<T> task, Duration timeout)
            throws TimeoutException, ExecutionException, InterruptedException {
        Future<T> future = pool.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    @Override
    public void destroy() {
        log.info("[BoundedCall] Shutting down I/O pool");
        pool.shutdownNow();
    }

    public static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
