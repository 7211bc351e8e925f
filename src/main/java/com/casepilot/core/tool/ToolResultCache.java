package com.casepilot.core.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory tool result cache shared by every concurrent investigation.
 *
 * TTL is tiered by {@link ToolClass}. Expiry is lazy: an expired entry is removed at
 * lookup time and reported as a miss. There is no background sweep; instead a {@code put}
 * that finds the map at or above {@code casepilot.cache.purge-threshold} entries first
 * drops every expired one, so keys that are never looked up again do not pile up.
 * Thread-safe via {@link ConcurrentHashMap}; removal of an expired entry only succeeds
 * if the entry was not replaced in the meantime.
 */
@Component
public class ToolResultCache {

    private static final Logger log = LoggerFactory.getLogger(ToolResultCache.class);

    static final int DEFAULT_PURGE_THRESHOLD = 1024;

    private final ConcurrentHashMap<String, CachedToolResult> store = new ConcurrentHashMap<>();
    private final Map<ToolClass, Duration> ttlByClass = new EnumMap<>(ToolClass.class);
    private final Clock clock;
    private final int purgeThreshold;

    private final AtomicLong hits   = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public ToolResultCache(Clock clock, Duration lookupTtl, Duration similarityTtl, Duration referenceTtl) {
        this(clock, lookupTtl, similarityTtl, referenceTtl, DEFAULT_PURGE_THRESHOLD);
    }

    @Autowired
    public ToolResultCache(
            Clock clock,
            @Value("${casepilot.cache.ttl.lookup:60s}")             Duration lookupTtl,
            @Value("${casepilot.cache.ttl.similarity-search:120s}") Duration similarityTtl,
            @Value("${casepilot.cache.ttl.reference-search:300s}")  Duration referenceTtl,
            @Value("${casepilot.cache.purge-threshold:1024}")       int purgeThreshold) {
        this.clock = clock;
        this.purgeThreshold = purgeThreshold;
        ttlByClass.put(ToolClass.LOOKUP,            lookupTtl);
        ttlByClass.put(ToolClass.SIMILARITY_SEARCH, similarityTtl);
        ttlByClass.put(ToolClass.REFERENCE_SEARCH,  referenceTtl);
    }

    public Optional<JsonNode> get(String key) {
        CachedToolResult entry = store.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (entry.isExpiredAt(clock.instant())) {
            store.remove(key, entry);
            misses.incrementAndGet();
            log.debug("[ToolCache] Expired key={} storedAt={}", key, entry.getStoredAt());
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(entry.getPayload());
    }

    public void put(String key, JsonNode payload, ToolClass toolClass) {
        Duration ttl = ttlFor(toolClass);
        Instant now = clock.instant();
        if (store.size() >= purgeThreshold) {
            purgeExpired(now);
        }
        store.put(key, new CachedToolResult(payload, now, ttl));
        log.debug("[ToolCache] Stored key={} class={} ttlSeconds={}", key, toolClass, ttl.toSeconds());
    }

    /** Drops every entry expired at {@code now}; returns how many were removed. */
    int purgeExpired(Instant now) {
        int removed = 0;
        for (Map.Entry<String, CachedToolResult> e : store.entrySet()) {
            if (e.getValue().isExpiredAt(now) && store.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("[ToolCache] Purged {} expired entries, {} remain", removed, store.size());
        }
        return removed;
    }

    public Duration ttlFor(ToolClass toolClass) {
        return ttlByClass.getOrDefault(toolClass, ttlByClass.get(ToolClass.LOOKUP));
    }

    public long getHitCount() {
        return hits.get();
    }

    public long getMissCount() {
        return misses.get();
    }

    /** Entries currently held, expired-but-not-yet-looked-up ones included. */
    public int size() {
        return store.size();
    }
}
