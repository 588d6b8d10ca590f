package com.netpilot.gateway.api.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

/** Request body for POST /tools/batch/status. */
public record BatchStatusRequest(@NotNull List<@NotNull String> jobIds) {}
