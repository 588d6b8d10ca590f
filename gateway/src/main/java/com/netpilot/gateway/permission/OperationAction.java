package com.netpilot.gateway.permission;

import java.util.Locale;

/**
 * The four kinds of action an operation performs on its category.
 *
 * Anything other than {@link #READ} is mutating and goes through the
 * confirmation protocol.
 */
public enum OperationAction {
    READ,
    CREATE,
    UPDATE,
    DELETE;

    public boolean isMutating() {
        return this != READ;
    }

    /**
     * The action whose permission rule governs this one.
     *
     * DELETE has no rule of its own and is decided by the UPDATE rule of the
     * same category.
     */
    public OperationAction permissionAction() {
        return this == DELETE ? UPDATE : this;
    }

    /** Lower-case name used in config files and manifests. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static OperationAction fromKey(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Operation action must not be null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown operation action: '" + name + "' (expected read, create, update or delete)", e);
        }
    }
}
