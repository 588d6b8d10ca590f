package com.netpilot.gateway.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Per-call diagnostic log line: {@code TOOL {"tool":..,"duration_ms":..,"args":..,"result":..}}.
 * Credential-like keys are masked at any depth before serialization.
 */
@Component
public class OperationDiagnostics {

    private static final Logger log = LoggerFactory.getLogger(OperationDiagnostics.class);

    static final String REDACTED = "***REDACTED***";

    private static final Set<String> REDACT_KEYS = Set.of(
            "password", "x_password", "x_passphrase", "passphrase",
            "token", "authorization", "auth", "cookie");

    private final DiagnosticsProperties properties;
    private final ObjectMapper          json;

    public OperationDiagnostics(DiagnosticsProperties properties, ObjectMapper json) {
        this.properties = properties;
        this.json       = json;
    }

    public boolean enabled() {
        return properties.enabled();
    }

    public void record(String operation, Map<String, Object> arguments, Object result,
                       long durationMs, String error) {
        if (!properties.enabled()) return;
        log.info("TOOL {}", render(operation, arguments, result, durationMs, error));
    }

    String render(String operation, Map<String, Object> arguments, Object result, long durationMs, String error) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("tool", operation);
        line.put("duration_ms", durationMs);
        if (properties.logArguments()) {
            line.put("args", arguments);
        }
        if (error != null) {
            line.put("error", error);
        } else if (properties.logResult()) {
            line.put("result", result);
        }

        String text;
        try {
            text = json.writeValueAsString(redact(json.convertValue(line, Object.class)));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            text = String.valueOf(redact(line));
        }
        return truncate(text, properties.maxPayloadChars());
    }

    static Object redact(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> {
                String key = String.valueOf(k);
                copy.put(key, REDACT_KEYS.contains(key.toLowerCase(Locale.ROOT)) ? REDACTED : redact(v));
            });
            return copy;
        }
        if (value instanceof Collection<?> items) {
            return items.stream().map(OperationDiagnostics::redact).toList();
        }
        return value;
    }

    static String truncate(String text, int limit) {
        if (text.length() <= limit) return text;
        return text.substring(0, limit) + "... [truncated " + (text.length() - limit) + " chars]";
    }
}
