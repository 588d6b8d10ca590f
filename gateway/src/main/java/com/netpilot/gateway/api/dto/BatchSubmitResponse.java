package com.netpilot.gateway.api.dto;

import java.util.List;

/** Response body for POST /tools/batch: one entry per submitted operation, in order. */
public record BatchSubmitResponse(List<SubmittedJob> jobs) {

    public record SubmittedJob(int index, String tool, String jobId) {}
}
