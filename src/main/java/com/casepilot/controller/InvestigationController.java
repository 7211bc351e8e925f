package com.casepilot.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.casepilot.core.issue.Issue;
import com.casepilot.core.issue.IssueService;
import com.casepilot.core.trace.RunTrace;
import com.casepilot.core.trace.RunTraceNotFoundException;
import com.casepilot.core.trace.RunTraceRepository;
import com.casepilot.orchestrator.InvestigationOrchestrator;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class InvestigationController {

    private final IssueService issueService;
    private final InvestigationOrchestrator orchestrator;
    private final RunTraceRepository traceRepository;

    public InvestigationController(IssueService issueService,
                                   InvestigationOrchestrator orchestrator,
                                   RunTraceRepository traceRepository) {
        this.issueService = issueService;
        this.orchestrator = orchestrator;
        this.traceRepository = traceRepository;
    }

    @PostMapping("/investigate/{issueId}")
    public ResponseEntity<RunTrace> investigate(@PathVariable String issueId) {
        Issue issue = issueService.getIssue(issueId);
        return ResponseEntity.ok(orchestrator.run(issue));
    }

    @GetMapping("/issues")
    public ResponseEntity<List<Issue>> listIssues() {
        return ResponseEntity.ok(issueService.listIssues());
    }

    @GetMapping("/runs/{traceId}")
    public ResponseEntity<RunTrace> getRun(@PathVariable String traceId) {
        return ResponseEntity.ok(traceRepository.findById(traceId)
                .orElseThrow(() -> new RunTraceNotFoundException(traceId)));
    }

    @GetMapping("/runs")
    public ResponseEntity<List<RunTrace>> listRuns(
            @RequestParam String issueId,
            @RequestParam(defaultValue = "false") boolean includeReplays) {
        return ResponseEntity.ok(traceRepository.findByIssueId(issueId, includeReplays));
    }
}
