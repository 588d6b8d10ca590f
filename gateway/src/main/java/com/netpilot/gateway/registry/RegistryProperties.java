package com.netpilot.gateway.registry;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * {@code gateway.registry.*}
 *
 * @param mode                eager (instantiate every handler at startup) or lazy
 *                            (register manifest descriptors, load on first call)
 * @param precheckPermissions lazy mode only: evaluate the permission gate at startup
 *                            instead of on first dispatch
 * @param manifest            location of the static tool manifest
 * @param enabledCategories   when non-empty, only these categories are registered
 * @param enabledTools        when non-empty, only these operation names are registered
 */
@ConfigurationProperties("gateway.registry")
public record RegistryProperties(
        @DefaultValue("EAGER") RegistrationMode mode,
        @DefaultValue("false") boolean precheckPermissions,
        @DefaultValue("classpath:tools-manifest.json") String manifest,
        List<String> enabledCategories,
        List<String> enabledTools) {

    public RegistryProperties {
        enabledCategories = enabledCategories == null ? List.of() : List.copyOf(enabledCategories);
        enabledTools      = enabledTools == null ? List.of() : List.copyOf(enabledTools);
    }
}
