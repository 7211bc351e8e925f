package com.casepilot.core.tool;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One-line, human-readable summaries of tool results for the audit trail.
 * Known tools get a tailored line; anything else reports its field count.
 */
public final class ToolResultSummarizer {

    private static final int MAX_SUMMARY_CHARS = 200;

    private ToolResultSummarizer() {
    }

    public static String summarise(String toolName, JsonNode result) {
        if (result == null || result.isNull()) {
            return "no result";
        }
        if (result.has("error")) {
            return error(result.get("error").asText());
        }

        String summary = switch (toolName) {
            case "customer_lookup" -> "Customer: " + text(result, "name") + " | KYC: " + text(result, "kyc_status");
            case "account_lookup" -> result.path("count").asInt(0) + " account(s) | statuses: "
                    + collect(result.path("accounts"), "status");
            case "account_login_history" -> result.path("count").asInt(0) + " event(s) | countries: "
                    + values(result.path("unique_countries"));
            case "account_communication_history" -> result.path("count").asInt(0) + " communication(s)";
            case "transactions_search" -> result.path("count").asInt(0) + " transaction(s) | type="
                    + text(result.path("filters"), "transaction_type")
                    + " status=" + text(result.path("filters"), "status");
            case "transactions_metadata" -> "tx " + abbreviate(text(result, "transaction_id"), 8)
                    + " | " + text(result, "status") + " | " + text(result, "amount") + " " + text(result, "currency");
            case "policy_search" -> result.path("count").asInt(0) + " policy chunk(s) for: '"
                    + abbreviate(text(result, "query"), 40) + "'";
            case "cases_similar" -> result.path("count").asInt(0) + " similar case(s)";
            default -> result.size() + " field(s) returned";
        };
        return abbreviate(summary, MAX_SUMMARY_CHARS);
    }

    public static String error(String message) {
        return abbreviate("ERROR: " + message, MAX_SUMMARY_CHARS);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? "None" : value.asText();
    }

    private static String collect(JsonNode array, String field) {
        List<String> out = new ArrayList<>();
        if (array.isArray()) {
            for (JsonNode item : array) {
                out.add(text(item, field));
            }
        }
        return out.toString();
    }

    private static String values(JsonNode array) {
        Set<String> out = new LinkedHashSet<>();
        if (array.isArray()) {
            array.forEach(v -> out.add(v.asText()));
        }
        return out.toString();
    }

    private static String abbreviate(String s, int max) {
        if (s == null) return "";
        return s.length() > max ? s.substring(0, max) + "..." : s;
    }
}
