package com.netpilot.gateway.job;

import java.time.Instant;
import java.util.Map;

/**
 * Consistent read of a {@link Job} at one instant.
 * {@code result} is set only when DONE, {@code error} only when ERROR.
 */
public record JobSnapshot(
        String              id,
        String              operationName,
        Map<String, Object> arguments,
        JobStatus           status,
        Object              result,
        String              error,
        Instant             createdAt,
        Instant             startedAt,
        Instant             completedAt) {}
