package com.netpilot.gateway.api.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Request body for POST /tools/execute.
 * {@code arguments} may carry the reserved {@code confirm} flag.
 */
public record ExecuteRequest(
        @NotBlank String tool,
        Map<String, Object> arguments) {}
