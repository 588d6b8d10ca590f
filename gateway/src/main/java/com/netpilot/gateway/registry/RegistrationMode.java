package com.netpilot.gateway.registry;

/**
 * How the registry is populated at startup.
 *
 * EAGER - every handler bean is created, its descriptor read and its
 *         permission fixed before the gateway accepts calls.
 * LAZY  - descriptors come from the static tool manifest; a handler bean is
 *         created on the first dispatch of its operation.
 */
public enum RegistrationMode {
    EAGER,
    LAZY
}
