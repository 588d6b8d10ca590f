package com.netpilot.gateway.permission;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Map;

/**
 * File-based permission configuration ({@code gateway.permissions.*}).
 *
 * @param overridePrefix prefix of the flat override keys, e.g.
 *                       {@code GATEWAY_PERMISSIONS_NETWORKS_UPDATE}
 * @param globalDefault  last-resort answer for mutating actions nobody configured;
 *                       {@code read} is always allowed at that level
 * @param defaults       action key to value, applied to every category that does
 *                       not set the action itself
 * @param categories     category key to (action key to value)
 */
@ConfigurationProperties("gateway.permissions")
public record PermissionProperties(
        @DefaultValue("GATEWAY_PERMISSIONS") String overridePrefix,
        @DefaultValue("true") boolean globalDefault,
        Map<String, Boolean> defaults,
        Map<String, Map<String, Boolean>> categories) {

    public PermissionProperties {
        if (defaults == null)   defaults   = Map.of();
        if (categories == null) categories = Map.of();
    }
}
