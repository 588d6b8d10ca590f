package com.netpilot.gateway.confirmation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Side-effect-free description of what a mutating call would change.
 *
 * Recomputed on every unconfirmed call and never stored.
 *
 * @param action       verb shown to the caller ("toggle", "update", "create", "delete")
 * @param resourceType e.g. "traffic_route"
 * @param resourceId   controller id of the target, null for creates
 * @param resourceName human-readable name, when known
 * @param current      relevant fields as they are now
 * @param proposed     the same fields as they would be after the call
 * @param message      one-line summary ending with the confirm instruction
 * @param warnings     optional caveats, e.g. "clients on this network lose connectivity"
 */
public record Preview(
        String              action,
        String              resourceType,
        String              resourceId,
        String              resourceName,
        Map<String, Object> current,
        Map<String, Object> proposed,
        String              message,
        List<String>        warnings) {

    static final String CONFIRM_HINT = "Set confirm=true to execute.";

    public Preview {
        current  = frozen(current);
        proposed = frozen(proposed);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (message == null || message.isBlank()) {
            message = "Review the changes above. " + CONFIRM_HINT;
        }
    }

    /** Preview for flipping an {@code enabled} flag. */
    public static Preview toggle(String resourceType,
                                 String resourceId,
                                 String resourceName,
                                 boolean currentlyEnabled,
                                 Map<String, Object> additionalInfo) {
        Map<String, Object> current = new LinkedHashMap<>();
        current.put("enabled", currentlyEnabled);
        if (additionalInfo != null) current.putAll(additionalInfo);

        String verb = currentlyEnabled ? "disable" : "enable";
        return new Preview("toggle", resourceType, resourceId, resourceName,
                current, Map.of("enabled", !currentlyEnabled),
                "Will %s %s %s. %s".formatted(verb, resourceType, label(resourceId, resourceName), CONFIRM_HINT),
                null);
    }

    /**
     * Preview for a partial update; {@code current} is narrowed to the keys
     * being changed.
     */
    public static Preview update(String resourceType,
                                 String resourceId,
                                 String resourceName,
                                 Map<String, Object> currentState,
                                 Map<String, Object> updates) {
        Map<String, Object> relevant = new LinkedHashMap<>();
        updates.keySet().forEach(k -> relevant.put(k, currentState == null ? null : currentState.get(k)));

        return new Preview("update", resourceType, resourceId, resourceName,
                relevant, updates,
                "Will update %s on %s %s. %s".formatted(String.join(", ", updates.keySet()),
                        resourceType, label(resourceId, resourceName), CONFIRM_HINT),
                null);
    }

    /** Preview for a create; there is no current state. */
    public static Preview create(String resourceType,
                                 Map<String, Object> resourceData,
                                 String resourceName,
                                 List<String> warnings) {
        String message = resourceName == null
                ? "Will create new %s. %s".formatted(resourceType, CONFIRM_HINT)
                : "Will create %s '%s'. %s".formatted(resourceType, resourceName, CONFIRM_HINT);
        return new Preview("create", resourceType, null, resourceName,
                Map.of(), resourceData, message, warnings);
    }

    /** Preview for a delete; nothing is proposed. */
    public static Preview delete(String resourceType,
                                 String resourceId,
                                 String resourceName,
                                 Map<String, Object> currentState,
                                 List<String> warnings) {
        return new Preview("delete", resourceType, resourceId, resourceName,
                currentState, Map.of(),
                "Will delete %s %s. %s".formatted(resourceType, label(resourceId, resourceName), CONFIRM_HINT),
                warnings);
    }

    private static String label(String id, String name) {
        return name != null ? "'" + name + "'" : id;
    }

    // Values may be null (unset fields), which Map.copyOf rejects.
    private static Map<String, Object> frozen(Map<String, Object> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
