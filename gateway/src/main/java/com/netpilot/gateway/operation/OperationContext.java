package com.netpilot.gateway.operation;

import java.util.UUID;

/**
 * Runtime context passed to every handler invocation.
 *
 * @param invocationId unique per call; tags log lines and diagnostics
 * @param jobId        owning batch job, or null for a synchronous dispatch
 */
public record OperationContext(String invocationId, String jobId) {

    public static OperationContext direct() {
        return new OperationContext(UUID.randomUUID().toString(), null);
    }

    public static OperationContext forJob(String jobId) {
        return new OperationContext(UUID.randomUUID().toString(), jobId);
    }
}
