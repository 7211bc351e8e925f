package com.casepilot.core.issue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.casepilot.core.error.InvalidInputException;

import java.util.List;

/**
 * Read access to issues and the lifecycle transitions an investigation triggers.
 *
 * OPEN → INVESTIGATING → RESOLVED | ESCALATED. A failed run hands the issue back to OPEN
 * so it can be investigated again.
 */
@Service
public class IssueService {

    private static final Logger log = LoggerFactory.getLogger(IssueService.class);

    private final IssueRepository issueRepository;

    public IssueService(IssueRepository issueRepository) {
        this.issueRepository = issueRepository;
    }

    public Issue register(Issue issue) {
        if (issue.getRawMessage() == null || issue.getRawMessage().isBlank()) {
            throw new InvalidInputException("Issue " + issue.getIssueId() + " has an empty message");
        }
        issueRepository.save(issue);
        log.info("[IssueService] Registered issue {}", issue.getIssueId());
        return issue;
    }

    public Issue getIssue(String issueId) {
        return issueRepository.findById(issueId)
                .orElseThrow(() -> new IssueNotFoundException(issueId));
    }

    public List<Issue> listIssues() {
        return issueRepository.findAll();
    }

    public void markInvestigating(String issueId) {
        transition(issueId, IssueStatus.INVESTIGATING);
    }

    public void markResolved(String issueId) {
        transition(issueId, IssueStatus.RESOLVED);
    }

    public void markEscalated(String issueId) {
        transition(issueId, IssueStatus.ESCALATED);
    }

    public void reopen(String issueId) {
        transition(issueId, IssueStatus.OPEN);
    }

    private void transition(String issueId, IssueStatus target) {
        issueRepository.updateStatus(issueId, target).ifPresentOrElse(
                issue -> log.info("[IssueService] Issue {} → {}", issueId, target),
                () -> log.warn("[IssueService] Cannot move issue {} to {} – issue not found", issueId, target));
    }
}
