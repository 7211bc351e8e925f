package com.casepilot.core.issue;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class IssueRepository {

    private final Map<String, Issue> issues = new ConcurrentHashMap<>();

    public void save(Issue issue) {
        issues.put(issue.getIssueId(), issue);
    }

    public Optional<Issue> findById(String issueId) {
        return Optional.ofNullable(issues.get(issueId));
    }

    // urgent first, then newest
    public List<Issue> findAll() {
        List<Issue> all = new ArrayList<>(issues.values());
        all.sort(Comparator.comparing(Issue::getUrgency).reversed()
                .thenComparing(Issue::getCreatedAt, Comparator.reverseOrder()));
        return all;
    }

    public Optional<Issue> updateStatus(String issueId, IssueStatus status) {
        return Optional.ofNullable(
                issues.computeIfPresent(issueId, (id, issue) -> issue.withStatus(status)));
    }
}
