package com.netpilot.gateway.registry;

import com.netpilot.gateway.operation.Operation;
import com.netpilot.gateway.operation.OperationDescriptor;

/**
 * Resolves a deferred handler reference into a live handler (lazy mode).
 *
 * Called at most once per operation per process; the registry guarantees
 * single-flight semantics around it.
 */
@FunctionalInterface
public interface OperationLoader {

    /**
     * @throws Exception if the handler class cannot be found, linked or instantiated
     */
    Operation load(OperationDescriptor descriptor) throws Exception;
}
