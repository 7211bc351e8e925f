package com.casepilot.core.trace;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for run traces. Called at loop start and at the terminal transition.
 */
public interface RunTraceRepository {

    void create(RunTrace trace);

    void update(RunTrace trace);

    Optional<RunTrace> findById(String traceId);

    /** Newest first. */
    List<RunTrace> findByIssueId(String issueId, boolean includeReplays);
}
