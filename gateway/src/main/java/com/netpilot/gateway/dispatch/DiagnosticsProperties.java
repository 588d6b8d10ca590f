package com.netpilot.gateway.dispatch;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * {@code gateway.diagnostics.*}
 *
 * @param enabled         log one JSON line per operation call
 * @param logArguments    include the call arguments
 * @param logResult       include the result (errors are always logged)
 * @param maxPayloadChars serialized line is cut after this many characters
 */
@ConfigurationProperties("gateway.diagnostics")
public record DiagnosticsProperties(
        @DefaultValue("false") boolean enabled,
        @DefaultValue("true") boolean logArguments,
        @DefaultValue("true") boolean logResult,
        @DefaultValue("2000") int maxPayloadChars) {}
