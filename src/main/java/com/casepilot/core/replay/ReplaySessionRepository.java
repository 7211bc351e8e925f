package com.casepilot.core.replay;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Component
public class ReplaySessionRepository {

    private final Map<String, ReplaySession> sessions = new ConcurrentHashMap<>();

    public void save(ReplaySession session) {
        sessions.put(session.getSessionId(), session);
    }

    public Optional<ReplaySession> findById(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    // newest first
    public List<ReplaySession> findBySourceTraceId(String sourceTraceId) {
        return sessions.values().stream()
                .filter(s -> s.getSourceTraceId().equals(sourceTraceId))
                .sorted(Comparator.comparing(ReplaySession::getStartedAt).reversed())
                .collect(Collectors.toList());
    }
}
