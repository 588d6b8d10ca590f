package com.netpilot.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.netpilot.gateway.job.JobSnapshot;

import java.time.Instant;

/**
 * One entry of a batch status response. {@code status} is one of
 * pending/running/done/error, or {@code unknown} for an id this process
 * never issued. Timestamps are omitted until the job reaches that point.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobView(
        String jobId,
        String status,
        String tool,
        Object result,
        String error,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt) {

    public static JobView from(JobSnapshot job) {
        return new JobView(job.id(), job.status().key(), job.operationName(), job.result(), job.error(),
                job.createdAt(), job.startedAt(), job.completedAt());
    }

    public static JobView unknown(String jobId) {
        return new JobView(jobId, "unknown", null, null, "Job not found: " + jobId, null, null, null);
    }
}
