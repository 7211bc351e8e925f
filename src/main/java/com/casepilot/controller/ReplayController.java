package com.casepilot.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.casepilot.core.replay.ReplayEngine;
import com.casepilot.core.replay.ReplaySession;
import com.casepilot.core.replay.ReplaySessionNotFoundException;
import com.casepilot.core.replay.ReplaySessionRepository;

import java.util.List;

@RestController
@RequestMapping("/api/v1/replay")
public class ReplayController {

    private final ReplayEngine replayEngine;
    private final ReplaySessionRepository sessionRepository;

    public ReplayController(ReplayEngine replayEngine, ReplaySessionRepository sessionRepository) {
        this.replayEngine = replayEngine;
        this.sessionRepository = sessionRepository;
    }

    @PostMapping("/{traceId}")
    public ResponseEntity<ReplaySession> startReplay(
            @PathVariable String traceId,
            @RequestParam(defaultValue = "3") int n,
            @RequestParam(required = false) Long seed) {
        ReplaySession session = replayEngine.startReplay(traceId, n, seed);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(session);
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<ReplaySession> getSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ReplaySessionNotFoundException(sessionId)));
    }

    @GetMapping
    public ResponseEntity<List<ReplaySession>> listSessions(@RequestParam String traceId) {
        return ResponseEntity.ok(sessionRepository.findBySourceTraceId(traceId));
    }
}
