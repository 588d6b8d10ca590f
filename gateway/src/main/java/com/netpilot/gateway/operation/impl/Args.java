package com.netpilot.gateway.operation.impl;

import com.netpilot.gateway.operation.OperationException;

import java.util.Map;

/** Typed reads of already-validated call arguments. */
final class Args {

    private Args() {}

    static String string(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value == null) {
            throw new OperationException(OperationException.Kind.VALIDATION_ERROR, "Missing argument '" + key + "'");
        }
        return value.toString();
    }

    static String string(Map<String, Object> args, String key, String fallback) {
        Object value = args.get(key);
        return value == null ? fallback : value.toString();
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> object(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (!(value instanceof Map<?, ?>)) {
            throw new OperationException(OperationException.Kind.VALIDATION_ERROR, "Argument '" + key + "' must be an object");
        }
        return (Map<String, Object>) value;
    }

    static OperationException notFound(String resourceType, String id) {
        return new OperationException(OperationException.Kind.HANDLER_ERROR,
                resourceType + " '" + id + "' not found");
    }
}
