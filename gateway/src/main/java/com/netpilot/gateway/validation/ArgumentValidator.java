package com.netpilot.gateway.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netpilot.gateway.operation.OperationDescriptor;
import com.netpilot.gateway.operation.OperationException;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Checks call arguments against the operation's input schema (JSON Schema
 * draft 7). Compiled schemas are cached by operation name.
 */
@Component
public class ArgumentValidator {

    private final JsonSchemaFactory       factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
    private final Map<String, JsonSchema> compiled = new ConcurrentHashMap<>();
    private final ObjectMapper            json;

    public ArgumentValidator(ObjectMapper json) {
        this.json = json;
    }

    /**
     * @param arguments call arguments with {@code confirm} already removed
     * @throws OperationException {@code VALIDATION_ERROR} listing every violation
     */
    public void validate(OperationDescriptor descriptor, Map<String, Object> arguments) {
        JsonSchema schema = compiled.computeIfAbsent(descriptor.name(),
                name -> factory.getSchema(descriptor.inputSchema()));
        JsonNode instance = json.valueToTree(arguments == null ? Map.of() : arguments);

        Set<ValidationMessage> errors = schema.validate(instance);
        if (!errors.isEmpty()) {
            String detail = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new OperationException(OperationException.Kind.VALIDATION_ERROR,
                    "Invalid arguments for '" + descriptor.name() + "': " + detail);
        }
    }
}
