package com.casepilot.core.replay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.casepilot.core.error.InvalidInputException;
import com.casepilot.core.executor.BoundedCallExecutor;
import com.casepilot.core.issue.Issue;
import com.casepilot.core.issue.IssueService;
import com.casepilot.core.terminal.StructuredOutput;
import com.casepilot.core.trace.RunTrace;
import com.casepilot.core.trace.RunTraceNotFoundException;
import com.casepilot.core.trace.RunTraceRepository;
import com.casepilot.core.trace.TraceContext;
import com.casepilot.orchestrator.InvestigationRunner;
import com.casepilot.orchestrator.RunOptions;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * ReplayEngine - re-runs an investigation on paraphrases of its issue message and
 * scores how often the verdict holds.
 *
 * A child matches when its resolution type and escalate decision equal the source's.
 * Children run concurrently on a fixed pool; each is a full investigation flagged as
 * a replay. The session fails if the children do not all finish within the session timeout.
 */
@Service
public class ReplayEngine implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(ReplayEngine.class);

    private final RunTraceRepository      traceRepository;
    private final IssueService            issueService;
    private final InvestigationRunner     runner;
    private final ParaphraseGenerator     paraphraseGenerator;
    private final ReplaySessionRepository sessionRepository;
    private final Clock                   clock;
    private final Duration                sessionTimeout;
    private final int                     maxRuns;

    private final ExecutorService childPool;
    private final ExecutorService sessionPool;

    public ReplayEngine(RunTraceRepository traceRepository,
                        IssueService issueService,
                        InvestigationRunner runner,
                        ParaphraseGenerator paraphraseGenerator,
                        ReplaySessionRepository sessionRepository,
                        Clock clock,
                        @Value("${casepilot.replay.parallelism:3}")        int parallelism,
                        @Value("${casepilot.replay.session-timeout:10m}")  Duration sessionTimeout,
                        @Value("${casepilot.replay.max-runs:10}")          int maxRuns) {
        this.traceRepository     = traceRepository;
        this.issueService        = issueService;
        this.runner              = runner;
        this.paraphraseGenerator = paraphraseGenerator;
        this.sessionRepository   = sessionRepository;
        this.clock               = clock;
        this.sessionTimeout      = sessionTimeout;
        this.maxRuns             = maxRuns;
        this.childPool   = Executors.newFixedThreadPool(parallelism, BoundedCallExecutor.namedDaemonThreads("casepilot-replay-"));
        this.sessionPool = Executors.newCachedThreadPool(BoundedCallExecutor.namedDaemonThreads("casepilot-replay-session-"));
    }

    // =========================================================================
    // Public API
    // =========================================================================

    /**
     * Runs a full replay session and returns it once it is COMPLETED or FAILED.
     *
     * @throws RunTraceNotFoundException if the source trace does not exist
     * @throws InvalidInputException     if n is out of range or the source has no verdict
     */
    public ReplaySession replay(String traceId, int n, Long seed) {
        Prepared prepared = prepare(traceId, n, seed);
        execute(prepared);
        return prepared.session;
    }

    /**
     * Starts a replay session in the background and returns it while still RUNNING.
     * Poll through {@link ReplaySessionRepository}.
     */
    public ReplaySession startReplay(String traceId, int n, Long seed) {
        Prepared prepared = prepare(traceId, n, seed);
        sessionPool.submit(() -> execute(prepared));
        return prepared.session;
    }

    // =========================================================================
    // Session lifecycle
    // =========================================================================

    private Prepared prepare(String traceId, int n, Long seed) {
        if (n < 1 || n > maxRuns) {
            throw new InvalidInputException("n must be between 1 and " + maxRuns + "; got " + n);
        }
        RunTrace source = traceRepository.findById(traceId)
                .orElseThrow(() -> new RunTraceNotFoundException(traceId));
        StructuredOutput original = source.getOutput();
        if (original == null) {
            throw new InvalidInputException("RunTrace " + traceId + " has no verdict to replay (status "
                    + source.getStatus() + ")");
        }
        Issue issue = issueService.getIssue(source.getIssueId());

        ReplaySession session = new ReplaySession(traceId, issue.getIssueId(), n, seed,
                original.getResolutionType(), original.isEscalate(), clock.instant());
        sessionRepository.save(session);
        log.info("[Replay] Session {} created: source={} n={} seed={}", session.getSessionId(), traceId, n, seed);
        return new Prepared(session, source, issue);
    }

    private void execute(Prepared prepared) {
        ReplaySession session = prepared.session;
        try (MDC.MDCCloseable ignored = TraceContext.bindReplaySession(session.getSessionId())) {
            List<String> paraphrases = paraphraseGenerator.generate(
                    prepared.issue.getRawMessage(), session.getNRuns(), session.getSeed());

            List<CompletableFuture<Void>> children = new ArrayList<>();
            for (int i = 0; i < paraphrases.size(); i++) {
                int index = i;
                String paraphrase = paraphrases.get(i);
                children.add(CompletableFuture.runAsync(
                        TraceContext.propagate(() -> runChild(prepared, index, paraphrase)), childPool));
            }

            CompletableFuture<Void> all = CompletableFuture.allOf(children.toArray(new CompletableFuture[0]));
            try {
                all.get(sessionTimeout.toMillis(), TimeUnit.MILLISECONDS);
                session.complete(clock.instant());
                log.info("[Replay] Session {} completed: {}/{} matching, stability={}",
                        session.getSessionId(), session.getMatches(), session.getNRuns(),
                        session.getStabilityScore().orElse(Double.NaN));
            } catch (TimeoutException e) {
                children.forEach(child -> child.cancel(true));
                session.fail("Session timed out after " + sessionTimeout, clock.instant());
                log.error("[Replay] Session {} timed out with {}/{} runs recorded",
                        session.getSessionId(), session.getRuns().size(), session.getNRuns());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                session.fail("Session interrupted", clock.instant());
            } catch (ExecutionException e) {
                session.fail("Replay child crashed: " + e.getCause(), clock.instant());
                log.error("[Replay] Session {} failed", session.getSessionId(), e.getCause());
            }
        } catch (RuntimeException e) {
            log.error("[Replay] Session {} aborted", session.getSessionId(), e);
            if (session.getStatus() == ReplayStatus.RUNNING) {
                session.fail("Replay aborted: " + e.getMessage(), clock.instant());
            }
        }
    }

    private void runChild(Prepared prepared, int index, String paraphrase) {
        ReplaySession session = prepared.session;
        ReplayRun run;
        try {
            RunTrace child = runner.run(prepared.issue.withRawMessage(paraphrase),
                    RunOptions.replayOf(prepared.source.getTraceId()));
            run = ReplayRun.completed(index, paraphrase, child,
                    session.getOriginalResolutionType(), session.isOriginalEscalate());
        } catch (RuntimeException e) {
            log.warn("[Replay] Child {} of session {} could not run: {}", index, session.getSessionId(), e.getMessage());
            run = ReplayRun.notStarted(index, paraphrase, e.getMessage());
        }
        if (!session.recordRun(run)) {
            log.warn("[Replay] Child {} finished after session {} closed; dropped", index, session.getSessionId());
        }
    }

    @Override
    public void destroy() {
        log.info("[Replay] Shutting down replay pools");
        sessionPool.shutdownNow();
        childPool.shutdownNow();
    }

    private static final class Prepared {
        private final ReplaySession session;
        private final RunTrace source;
        private final Issue issue;

        private Prepared(ReplaySession session, RunTrace source, Issue issue) {
            this.session = session;
            this.source = source;
            this.issue = issue;
        }
    }
}
