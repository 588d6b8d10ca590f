package com.netpilot.gateway.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netpilot.gateway.operation.OperationDescriptor;
import com.netpilot.gateway.permission.OperationAction;
import com.netpilot.gateway.permission.OperationCategory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Static tool manifest: every operation's descriptor, available without
 * loading any handler.
 *
 * <pre>
 * { "tools": [ { "name", "description", "category", "action", "handler",
 *                "schema": { "input": {...}, "output": {...} } } ],
 *   "count": n }
 * </pre>
 *
 * The manifest is checked in next to the handlers and must describe them
 * exactly; {@code OperationManifestTest} compares the two.
 */
public final class OperationManifest {

    private OperationManifest() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Document(List<Tool> tools, Integer count) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Tool(String name, String description, String category, String action, String handler, Schema schema) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Schema(JsonNode input, JsonNode output) {}

    /**
     * Parse a manifest.
     *
     * @throws IOException              if the stream is unreadable or not JSON
     * @throws IllegalArgumentException if an entry names an unknown category or
     *                                  action, lacks a handler, or {@code count}
     *                                  disagrees with the number of tools
     */
    public static List<OperationDescriptor> read(InputStream in, ObjectMapper json) throws IOException {
        Document doc = json.readValue(in, Document.class);
        List<Tool> tools = doc.tools() == null ? List.of() : doc.tools();
        if (doc.count() != null && doc.count() != tools.size()) {
            throw new IllegalArgumentException("Manifest count " + doc.count()
                    + " does not match its " + tools.size() + " tools");
        }

        List<OperationDescriptor> descriptors = new ArrayList<>(tools.size());
        for (int i = 0; i < tools.size(); i++) {
            Tool tool = tools.get(i);
            try {
                descriptors.add(new OperationDescriptor(
                        tool.name(),
                        tool.description(),
                        OperationCategory.fromKey(require(tool.category(), "category")),
                        OperationAction.fromKey(require(tool.action(), "action")),
                        tool.schema() == null ? null : tool.schema().input(),
                        tool.schema() == null ? null : tool.schema().output(),
                        tool.handler()));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Manifest entry #" + i
                        + (tool.name() == null ? "" : " ('" + tool.name() + "')") + ": " + e.getMessage(), e);
            }
        }
        return descriptors;
    }

    /** Render descriptors in manifest form, e.g. to regenerate the checked-in file. */
    public static String write(List<OperationDescriptor> descriptors, ObjectMapper json) throws IOException {
        List<Tool> tools = descriptors.stream()
                .map(d -> new Tool(d.name(), d.description(), d.category().key(), d.action().key(),
                        d.handlerRef(), new Schema(d.inputSchema(), d.outputSchema())))
                .toList();
        return json.writerWithDefaultPrettyPrinter().writeValueAsString(new Document(tools, tools.size()));
    }

    private static String require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("missing '" + field + "'");
        }
        return value;
    }
}
