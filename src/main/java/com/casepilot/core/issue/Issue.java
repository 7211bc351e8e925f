package com.casepilot.core.issue;

import java.time.Instant;
import java.util.Objects;

/**
 * A customer-reported issue. Immutable: status changes and paraphrased
 * messages produce a new Issue via the with* methods.
 */
public final class Issue {

    private final String issueId;
    private final String customerId;
    private final String rawMessage;
    private final String channel;
    private final UrgencyTier urgency;
    private final IssueStatus status;
    private final Instant createdAt;

    public Issue(String issueId,
                 String customerId,
                 String rawMessage,
                 String channel,
                 UrgencyTier urgency,
                 IssueStatus status,
                 Instant createdAt) {
        this.issueId = Objects.requireNonNull(issueId, "issueId");
        this.customerId = customerId;
        this.rawMessage = rawMessage;
        this.channel = channel != null ? channel : "chat";
        this.urgency = urgency != null ? urgency : UrgencyTier.MEDIUM;
        this.status = status != null ? status : IssueStatus.OPEN;
        this.createdAt = createdAt != null ? createdAt : Instant.now();
    }

    public static Issue open(String issueId, String customerId, String rawMessage,
                             String channel, UrgencyTier urgency) {
        return new Issue(issueId, customerId, rawMessage, channel, urgency, IssueStatus.OPEN, Instant.now());
    }

    public Issue withStatus(IssueStatus newStatus) {
        return new Issue(issueId, customerId, rawMessage, channel, urgency, newStatus, createdAt);
    }

    public Issue withRawMessage(String message) {
        return new Issue(issueId, customerId, message, channel, urgency, status, createdAt);
    }

    public String getIssueId() {
        return issueId;
    }

    public String getCustomerId() {
        return customerId;
    }

    public String getRawMessage() {
        return rawMessage;
    }

    public String getChannel() {
        return channel;
    }

    public UrgencyTier getUrgency() {
        return urgency;
    }

    public IssueStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "Issue{id='" + issueId + "', customer='" + customerId
                + "', urgency=" + urgency + ", status=" + status + "}";
    }
}
