package com.casepilot.orchestrator;

import com.casepilot.core.issue.Issue;
import com.casepilot.core.trace.RunTrace;

/**
 * Runs one investigation to a terminal RunTrace.
 */
public interface InvestigationRunner {

    RunTrace run(Issue issue, RunOptions options);
}
