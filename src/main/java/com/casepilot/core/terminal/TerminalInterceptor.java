package com.casepilot.core.terminal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.casepilot.core.agent.NextAction;
import com.casepilot.core.error.MalformedTerminalOutputException;
import com.casepilot.core.tool.ToolDefinition;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Recognises the reserved terminal tool and turns its payload into a {@link StructuredOutput}.
 *
 * The terminal tool is offered to the model alongside the catalog but is never part of
 * the ToolCatalog, so it can never reach the dispatcher or an external tool executor.
 *
 * Required payload fields: resolution_type, confidence_score, escalate.
 * confidence_score outside [0,1] is rejected, not clamped.
 */
@Component
public class TerminalInterceptor {

    private static final Logger log = LoggerFactory.getLogger(TerminalInterceptor.class);

    public static final String TERMINAL_TOOL_NAME = "submit_resolution";

    private static final String SCHEMA_RESOURCE = "terminal-tool.json";

    private static final Set<String> KNOWN_FIELDS = Set.of(
            "issue_type", "root_cause", "resolution", "resolution_type", "next_steps",
            "confidence_score", "escalate", "escalation_priority", "policy_flags");

    private final ToolDefinition definition;

    public TerminalInterceptor(ObjectMapper objectMapper) {
        this.definition = loadDefinition(objectMapper);
    }

    /** Definition offered to the completion capability; never registered as a dispatchable tool. */
    public ToolDefinition definition() {
        return definition;
    }

    /**
     * @return the validated verdict if the action is the terminal tool, empty otherwise
     * @throws MalformedTerminalOutputException if the terminal payload violates the schema
     */
    public Optional<StructuredOutput> intercept(NextAction action) {
        if (!(action instanceof NextAction.TerminalAnswer)) {
            return Optional.empty();
        }
        NextAction.TerminalAnswer terminal = (NextAction.TerminalAnswer) action;
        StructuredOutput output = parse(terminal.getInvocation().getArgs());
        log.info("[Terminal] Captured verdict: {}", output);
        return Optional.of(output);
    }

    StructuredOutput parse(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new MalformedTerminalOutputException("Terminal payload must be a JSON object");
        }

        ResolutionType resolutionType = ResolutionType.parse(requireText(payload, "resolution_type"))
                .orElseThrow(() -> new MalformedTerminalOutputException(
                        "resolution_type must be one of AUTO_RESOLVED, ESCALATED, REFUNDED, CORRECTED; got '"
                                + payload.get("resolution_type").asText() + "'"));

        double confidence = requireConfidence(payload);
        boolean escalate = requireBoolean(payload, "escalate");

        StructuredOutput.Builder builder = StructuredOutput.builder(resolutionType, confidence, escalate)
                .issueType(optionalText(payload, "issue_type", "GENERAL"))
                .rootCause(optionalText(payload, "root_cause", ""))
                .resolution(optionalText(payload, "resolution", ""));

        String priority = optionalText(payload, "escalation_priority", null);
        if (priority != null && !priority.isBlank()) {
            builder.escalationPriority(EscalationPriority.parse(priority)
                    .orElseThrow(() -> new MalformedTerminalOutputException(
                            "escalation_priority must be LOW, MEDIUM, HIGH or CRITICAL; got '" + priority + "'")));
        }

        JsonNode steps = payload.path("next_steps");
        if (steps.isArray()) {
            steps.forEach(step -> {
                String text = step.asText().trim();
                if (!text.isEmpty()) builder.nextStep(text);
            });
        } else if (steps.isTextual() && !steps.asText().isBlank()) {
            builder.nextStep(steps.asText().trim());
        }

        JsonNode flags = payload.path("policy_flags");
        if (flags.isArray()) {
            flags.forEach(flag -> {
                String code = flag.isObject() ? flag.path("flag_type").asText() : flag.asText();
                code = code.trim().toUpperCase();
                if (!code.isEmpty()) builder.policyFlag(code);
            });
        }

        Iterator<Map.Entry<String, JsonNode>> fields = payload.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!KNOWN_FIELDS.contains(field.getKey())) {
                builder.extra(field.getKey(), field.getValue());
            }
        }

        return builder.build();
    }

    // =========================================================================
    // Field validation
    // =========================================================================

    private String requireText(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull() || !node.isValueNode() || node.asText().isBlank()) {
            throw new MalformedTerminalOutputException("Missing required field: " + field);
        }
        return node.asText();
    }

    private double requireConfidence(JsonNode payload) {
        JsonNode node = payload.get("confidence_score");
        if (node == null || node.isNull()) {
            throw new MalformedTerminalOutputException("Missing required field: confidence_score");
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new MalformedTerminalOutputException("confidence_score is not a number: '" + node.asText() + "'");
            }
        } else {
            throw new MalformedTerminalOutputException("confidence_score is not a number: " + node);
        }
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new MalformedTerminalOutputException("confidence_score out of range [0,1]: " + value);
        }
        return value;
    }

    private boolean requireBoolean(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            throw new MalformedTerminalOutputException("Missing required field: " + field);
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            if ("true".equalsIgnoreCase(text)) return true;
            if ("false".equalsIgnoreCase(text)) return false;
        }
        throw new MalformedTerminalOutputException(field + " must be a boolean: " + node);
    }

    private String optionalText(JsonNode payload, String field, String defaultValue) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        return node.asText();
    }

    private static ToolDefinition loadDefinition(ObjectMapper mapper) {
        try (InputStream in = TerminalInterceptor.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            JsonNode root = mapper.readTree(in);
            return new ToolDefinition(TERMINAL_TOOL_NAME, root.path("description").asText(), root.get("input_schema"));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + SCHEMA_RESOURCE, e);
        }
    }
}
