package com.netpilot.gateway.permission;

import java.util.Locale;
import java.util.Set;

/**
 * Boolean parsing for string-typed switches (environment overrides, loosely
 * typed arguments).
 */
public final class Flags {

    private static final Set<String> TRUTHY = Set.of("true", "1", "yes", "on");

    private Flags() {}

    /** {@code true}, {@code 1}, {@code yes}, {@code on} in any case; everything else is false. */
    public static boolean isTruthy(String value) {
        return value != null && TRUTHY.contains(value.strip().toLowerCase(Locale.ROOT));
    }

    /**
     * Interpret a loosely typed value: booleans as-is, strings via
     * {@link #isTruthy(String)}, null as {@code defaultValue}.
     */
    public static boolean isTruthy(Object value, boolean defaultValue) {
        if (value == null) return defaultValue;
        if (value instanceof Boolean b) return b;
        return isTruthy(value.toString());
    }
}
