package com.casepilot.core.tool;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable cache entry: a successful tool payload with the moment it was stored
 * and the TTL chosen for its tool class.
 */
public final class CachedToolResult {

    private final JsonNode payload;
    private final Instant storedAt;
    private final Duration ttl;

    public CachedToolResult(JsonNode payload, Instant storedAt, Duration ttl) {
        this.payload = payload;
        this.storedAt = storedAt;
        this.ttl = ttl;
    }

    public JsonNode getPayload() {
        return payload;
    }

    public Instant getStoredAt() {
        return storedAt;
    }

    public Duration getTtl() {
        return ttl;
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(storedAt.plus(ttl));
    }
}
