package com.netpilot.gateway.operation;

import com.fasterxml.jackson.databind.JsonNode;
import com.netpilot.gateway.permission.OperationAction;
import com.netpilot.gateway.permission.OperationCategory;

/**
 * Identity, documentation and permission metadata of an operation.
 *
 * Built either from a live handler (eager mode) or from the static tool
 * manifest (lazy mode); in both cases the same descriptor must come out for
 * the same operation.
 *
 * @param name         globally unique operation name, e.g. {@code "toggle_traffic_route"}
 * @param description  one-sentence summary shown by discovery
 * @param category     resource category the permission gate evaluates
 * @param action       read/create/update/delete; anything but read is mutating
 * @param inputSchema  JSON Schema (draft 7) of the call arguments
 * @param outputSchema JSON Schema of the result, or null when undocumented
 * @param handlerRef   fully-qualified handler class name; the lazy loader's token
 */
public record OperationDescriptor(
        String            name,
        String            description,
        OperationCategory category,
        OperationAction   action,
        JsonNode          inputSchema,
        JsonNode          outputSchema,
        String            handlerRef) {

    public OperationDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Operation name must not be blank");
        }
        if (category == null || action == null) {
            throw new IllegalArgumentException("Operation '" + name + "' needs a category and an action");
        }
        if (handlerRef == null || handlerRef.isBlank()) {
            throw new IllegalArgumentException("Operation '" + name + "' has no handler reference");
        }
        description  = description == null ? "" : description;
        inputSchema  = inputSchema == null ? Schemas.emptyObject() : inputSchema.deepCopy();
        outputSchema = outputSchema == null ? null : outputSchema.deepCopy();
    }

    /** Descriptor for a handler class, with schemas given as JSON text. */
    public static OperationDescriptor of(String name,
                                         String description,
                                         OperationCategory category,
                                         OperationAction action,
                                         String inputSchemaJson,
                                         Class<? extends Operation> handler) {
        return new OperationDescriptor(name, description, category, action,
                Schemas.parse(inputSchemaJson), null, handler.getName());
    }

    public boolean isMutating() {
        return action.isMutating();
    }

    public OperationDescriptor withOutputSchema(String outputSchemaJson) {
        return new OperationDescriptor(name, description, category, action,
                inputSchema, Schemas.parse(outputSchemaJson), handlerRef);
    }
}
