package com.casepilot.core.trace;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Component
public class InMemoryRunTraceRepository implements RunTraceRepository {

    private final Map<String, RunTrace> traces = new ConcurrentHashMap<>();

    @Override
    public void create(RunTrace trace) {
        if (traces.putIfAbsent(trace.getTraceId(), trace) != null) {
            throw new IllegalStateException("RunTrace already exists: " + trace.getTraceId());
        }
    }

    @Override
    public void update(RunTrace trace) {
        if (traces.replace(trace.getTraceId(), trace) == null) {
            throw new IllegalStateException("Unknown RunTrace: " + trace.getTraceId());
        }
    }

    @Override
    public Optional<RunTrace> findById(String traceId) {
        return Optional.ofNullable(traces.get(traceId));
    }

    @Override
    public List<RunTrace> findByIssueId(String issueId, boolean includeReplays) {
        return traces.values().stream()
                .filter(t -> t.getIssueId().equals(issueId))
                .filter(t -> includeReplays || !t.isReplay())
                .sorted(Comparator.comparing(RunTrace::getStartedAt).reversed())
                .collect(Collectors.toList());
    }
}
