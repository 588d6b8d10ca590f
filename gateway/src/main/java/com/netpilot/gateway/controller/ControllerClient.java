package com.netpilot.gateway.controller;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP client for the network controller's REST API.
 *
 * Site-scoped paths come in two flavours: classic {@code /api/s/<site>/...}
 * endpoints wrap their payload as {@code {"meta":{"rc":"ok"},"data":[...]}},
 * {@code /v2/api/site/<site>/...} endpoints return the payload bare. Both are
 * unwrapped to a list of JSON objects here.
 *
 * Calls block; handlers run on the request thread or a job worker.
 */
@Component
public class ControllerClient {

    private static final Logger log = LoggerFactory.getLogger(ControllerClient.class);

    private static final TypeReference<Map<String, Object>>       OBJECT  = new TypeReference<>() {};
    private static final TypeReference<List<Map<String, Object>>> OBJECTS = new TypeReference<>() {};

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       site;
    private final String       apiKey;
    private final Duration     timeout;

    public ControllerClient(
            @Value("${gateway.controller.base-url}") String baseUrl,
            @Value("${gateway.controller.site:default}") String site,
            @Value("${gateway.controller.api-key:}") String apiKey,
            @Value("${gateway.controller.timeout:30s}") Duration timeout,
            ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.site    = site;
        this.apiKey  = apiKey;
        this.timeout = timeout;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // Paths
    // ------------------------------------------------------------------

    /** {@code /api/s/<site><suffix>} */
    public String sitePath(String suffix) {
        return "/api/s/" + site + suffix;
    }

    /** {@code /v2/api/site/<site><suffix>} */
    public String v2SitePath(String suffix) {
        return "/v2/api/site/" + site + suffix;
    }

    // ------------------------------------------------------------------
    // Verbs
    // ------------------------------------------------------------------

    public List<Map<String, Object>> list(String path) {
        return objects(send("GET", path, null), "GET " + path);
    }

    /** First object whose {@code idField} equals {@code id}. */
    public Optional<Map<String, Object>> find(String path, String idField, String id) {
        return list(path).stream()
                .filter(o -> id.equals(String.valueOf(o.get(idField))))
                .findFirst();
    }

    public Map<String, Object> create(String path, Map<String, Object> body) {
        log.info("Creating resource at {}", path);
        return first(objects(send("POST", path, body), "POST " + path));
    }

    public Map<String, Object> update(String path, Map<String, Object> body) {
        log.info("Updating resource at {}", path);
        return first(objects(send("PUT", path, body), "PUT " + path));
    }

    public void delete(String path) {
        log.info("Deleting resource at {}", path);
        send("DELETE", path, null);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private JsonNode send(String method, String path, Map<String, Object> body) {
        String opName = method + " " + path;
        try {
            HttpRequest.Builder req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Accept", "application/json");
            if (!apiKey.isBlank()) {
                req.header("X-API-KEY", apiKey);
            }
            if (body != null) {
                req.header("Content-Type", "application/json")
                   .method(method, HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)));
            } else {
                req.method(method, HttpRequest.BodyPublishers.noBody());
            }

            HttpResponse<String> resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ControllerException(opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            String text = resp.body();
            JsonNode node = text == null || text.isBlank() ? json.nullNode() : json.readTree(text);
            log.debug("{} -> HTTP {}", opName, resp.statusCode());
            return unwrap(node, opName);
        } catch (ControllerException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ControllerException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new ControllerException(opName + " failed", e);
        }
    }

    /** Strip the classic {@code meta/data} envelope, failing on {@code rc != ok}. */
    static JsonNode unwrap(JsonNode node, String opName) {
        if (node.isObject() && node.has("meta") && node.has("data")) {
            String rc = node.path("meta").path("rc").asText("");
            if (!"ok".equals(rc)) {
                throw new ControllerException(opName + " rejected by controller: "
                        + node.path("meta").path("msg").asText(rc));
            }
            return node.get("data");
        }
        return node;
    }

    private List<Map<String, Object>> objects(JsonNode node, String opName) {
        try {
            if (node.isArray()) {
                return json.convertValue(node, OBJECTS);
            }
            if (node.isObject()) {
                return List.of(json.convertValue(node, OBJECT));
            }
            return List.of();
        } catch (IllegalArgumentException e) {
            throw new ControllerException("Unexpected " + opName + " response shape", e);
        }
    }

    private static Map<String, Object> first(List<Map<String, Object>> objects) {
        return objects.isEmpty() ? Map.of() : objects.get(0);
    }
}
