package com.casepilot.core.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable, truncated SHA-256 digests of tool arguments.
 *
 * Arguments are serialized with map keys sorted at every level, so {"a":1,"b":2} and
 * {"b":2,"a":1} digest identically. Truncation makes collisions possible; at 12–16 hex
 * chars that risk is accepted.
 */
public final class ArgsDigest {

    /** Length used in ToolCallRecords (audit trail). */
    public static final int RECORD_LENGTH = 12;

    /** Length used in cache keys. */
    public static final int CACHE_KEY_LENGTH = 16;

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private ArgsDigest() {
    }

    public static String of(JsonNode args, int length) {
        String canonical = canonicalJson(args);
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            byte[] hash = sha.digest(canonical.getBytes(StandardCharsets.UTF_8));
            String hex = HexFormat.of().formatHex(hash);
            return hex.substring(0, Math.min(length, hex.length()));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    public static String cacheKey(String toolName, JsonNode args) {
        return "tool:" + toolName + ":" + of(args, CACHE_KEY_LENGTH);
    }

    static String canonicalJson(JsonNode args) {
        if (args == null || args.isNull() || args.isMissingNode()) {
            return "{}";
        }
        try {
            Object plain = CANONICAL.convertValue(args, Object.class);
            return CANONICAL.writeValueAsString(plain);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tool arguments are not serializable", e);
        }
    }
}
