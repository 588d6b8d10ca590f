package com.netpilot.gateway.registry;

import com.netpilot.gateway.operation.OperationDescriptor;

/**
 * Point-in-time view of one registry slot.
 *
 * @param descriptor operation metadata
 * @param status     callable / denied / unresolved
 * @param loadError  why the lazy load failed; non-null only for entries
 *                   denied because their handler could not be loaded
 * @param resident   true once the handler instance exists
 */
public record RegistryEntry(
        OperationDescriptor descriptor,
        RegistrationStatus  status,
        String              loadError,
        boolean             resident) {

    public String name() {
        return descriptor.name();
    }

    public boolean isCallable() {
        return status == RegistrationStatus.CALLABLE;
    }
}
