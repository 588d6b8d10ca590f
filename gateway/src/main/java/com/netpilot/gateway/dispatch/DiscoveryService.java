package com.netpilot.gateway.dispatch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.netpilot.gateway.operation.OperationDescriptor;
import com.netpilot.gateway.registry.OperationRegistry;
import com.netpilot.gateway.registry.RegistryEntry;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Read-only listing of every registered operation, callable or not.
 * Never loads a handler.
 */
@Service
public class DiscoveryService {

    private final OperationRegistry registry;

    public DiscoveryService(OperationRegistry registry) {
        this.registry = registry;
    }

    public Discovery discover() {
        List<ToolView> tools = registry.snapshot().stream().map(ToolView::from).toList();
        return new Discovery(tools, tools.size());
    }

    public record Discovery(List<ToolView> tools, int count) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ToolView(String name, String description, String category, String action,
                           String status, SchemaView schema) {

        static ToolView from(RegistryEntry entry) {
            OperationDescriptor d = entry.descriptor();
            return new ToolView(d.name(), d.description(), d.category().key(), d.action().key(),
                    entry.status().name().toLowerCase(Locale.ROOT),
                    new SchemaView(d.inputSchema(), d.outputSchema()));
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SchemaView(JsonNode input, JsonNode output) {}
}
