package com.netpilot.gateway.permission;

import java.util.Optional;

/**
 * Highest-precedence source of permission values, addressed by flat keys of
 * the form {@code <PREFIX>_<CATEGORY>_<ACTION>}.
 *
 * Values are raw strings; the gate applies truthy parsing.
 */
@FunctionalInterface
public interface PermissionOverrideSource {

    Optional<String> lookup(String key);

    static PermissionOverrideSource none() {
        return key -> Optional.empty();
    }
}
