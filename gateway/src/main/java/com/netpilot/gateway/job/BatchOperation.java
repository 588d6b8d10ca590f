package com.netpilot.gateway.job;

import java.util.Map;

/** One entry of a batch submission. */
public record BatchOperation(String tool, Map<String, Object> arguments) {}
