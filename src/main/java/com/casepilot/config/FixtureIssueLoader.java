package com.casepilot.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Profile;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.casepilot.core.issue.Issue;
import com.casepilot.core.issue.IssueService;
import com.casepilot.core.issue.UrgencyTier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Seeds the issue store from fixtures/issues.json once the application is ready.
 */
@Component
@Profile("mock")
public class FixtureIssueLoader {

    private static final Logger log = LoggerFactory.getLogger(FixtureIssueLoader.class);

    static final String ISSUES_RESOURCE = "fixtures/issues.json";

    private final IssueService issueService;
    private final ObjectMapper objectMapper;

    public FixtureIssueLoader(IssueService issueService, ObjectMapper objectMapper) {
        this.issueService = issueService;
        this.objectMapper = objectMapper;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void seedIssues() {
        try (InputStream in = FixtureIssueLoader.class.getClassLoader().getResourceAsStream(ISSUES_RESOURCE)) {
            if (in == null) {
                log.warn("[Fixtures] {} not found; no issues seeded", ISSUES_RESOURCE);
                return;
            }
            int count = 0;
            for (JsonNode node : objectMapper.readTree(in).path("issues")) {
                issueService.register(Issue.open(
                        node.path("issue_id").asText(),
                        node.path("customer_id").asText(),
                        node.path("raw_message").asText(),
                        node.path("channel").asText("chat"),
                        UrgencyTier.parse(node.path("urgency").asText(null))));
                count++;
            }
            log.info("[Fixtures] Seeded {} issue(s)", count);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + ISSUES_RESOURCE, e);
        }
    }
}
