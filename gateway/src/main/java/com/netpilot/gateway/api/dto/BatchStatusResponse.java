package com.netpilot.gateway.api.dto;

import java.util.List;

/** Response body for POST /tools/batch/status, in request order. */
public record BatchStatusResponse(List<JobView> jobs) {}
