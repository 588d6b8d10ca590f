package com.netpilot.gateway.permission;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a (category, action) pair may execute.
 *
 * <p>Resolution stops at the first source that defines a value:
 * <ol>
 *   <li>override source key {@code <PREFIX>_<CATEGORY>_<ACTION>}, truthy-parsed;</li>
 *   <li>{@code gateway.permissions.categories.<category>.<action>};</li>
 *   <li>{@code gateway.permissions.defaults.<action>} (the category default);</li>
 *   <li>global default: {@code read} is allowed, anything else takes
 *       {@code gateway.permissions.global-default}.</li>
 * </ol>
 *
 * DELETE is looked up under UPDATE at every level.
 *
 * The file-based levels are parsed once at construction into enum maps, so
 * unknown category or action keys fail startup. The gate holds no mutable
 * state and never consults the registry; it is safe to call from any thread.
 */
@Component
public class PermissionGate {

    private static final Logger log = LoggerFactory.getLogger(PermissionGate.class);

    private final PermissionOverrideSource overrides;
    private final String overridePrefix;
    private final boolean globalDefault;
    private final Map<OperationAction, Boolean> defaults;
    private final Map<OperationCategory, Map<OperationAction, Boolean>> categories;

    public PermissionGate(PermissionProperties properties, PermissionOverrideSource overrides) {
        this.overrides      = overrides;
        this.overridePrefix = properties.overridePrefix().toUpperCase(Locale.ROOT);
        this.globalDefault  = properties.globalDefault();
        this.defaults       = parseActions(properties.defaults(), "gateway.permissions.defaults");

        Map<OperationCategory, Map<OperationAction, Boolean>> parsed = new EnumMap<>(OperationCategory.class);
        properties.categories().forEach((categoryKey, actions) -> {
            OperationCategory category;
            try {
                category = OperationCategory.fromKey(categoryKey);
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid key under gateway.permissions.categories: "
                        + e.getMessage(), e);
            }
            parsed.put(category, parseActions(actions,
                    "gateway.permissions.categories." + category.key()));
        });
        this.categories = Collections.unmodifiableMap(parsed);

        log.info("Permission gate ready: {} configured categories, override prefix '{}', global default {}",
                categories.size(), overridePrefix, globalDefault);
    }

    /** True if operations of this category and action may execute. */
    public boolean allowed(OperationCategory category, OperationAction action) {
        OperationAction effective = action.permissionAction();

        String overrideKey = overrideKey(category, effective);
        Optional<String> override = overrides.lookup(overrideKey);
        if (override.isPresent()) {
            boolean allowed = Flags.isTruthy(override.get());
            log.info("Permission override {}={} -> {}", overrideKey, override.get(), allowed);
            return allowed;
        }

        Boolean configured = categories.getOrDefault(category, Map.of()).get(effective);
        if (configured != null) {
            log.debug("Permission {}/{} from category config -> {}", category.key(), action.key(), configured);
            return configured;
        }

        Boolean categoryDefault = defaults.get(effective);
        if (categoryDefault != null) {
            log.debug("Permission {}/{} from defaults -> {}", category.key(), action.key(), categoryDefault);
            return categoryDefault;
        }

        boolean fallback = effective == OperationAction.READ || globalDefault;
        log.debug("Permission {}/{} not configured, global default -> {}", category.key(), action.key(), fallback);
        return fallback;
    }

    /** Override key for a pair, e.g. {@code GATEWAY_PERMISSIONS_TRAFFIC_ROUTES_UPDATE}. */
    public String overrideKey(OperationCategory category, OperationAction action) {
        return overridePrefix + "_" + category.key().toUpperCase(Locale.ROOT)
                + "_" + action.permissionAction().name();
    }

    private static Map<OperationAction, Boolean> parseActions(Map<String, Boolean> raw, String path) {
        Map<OperationAction, Boolean> parsed = new EnumMap<>(OperationAction.class);
        if (raw == null) return parsed;
        raw.forEach((actionKey, value) -> {
            OperationAction action;
            try {
                action = OperationAction.fromKey(actionKey);
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid key under " + path + ": " + e.getMessage(), e);
            }
            if (action == OperationAction.DELETE) {
                log.warn("{}.delete is ignored: delete is governed by the update rule", path);
                return;
            }
            if (value != null) {
                parsed.put(action, value);
            }
        });
        return Collections.unmodifiableMap(parsed);
    }
}
