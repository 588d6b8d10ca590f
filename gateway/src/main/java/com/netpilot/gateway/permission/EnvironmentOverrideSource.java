package com.netpilot.gateway.permission;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads overrides from the Spring {@link Environment}: OS environment
 * variables, system properties and command-line arguments, e.g.
 * {@code GATEWAY_PERMISSIONS_NETWORKS_CREATE=true}.
 */
@Component
public class EnvironmentOverrideSource implements PermissionOverrideSource {

    private final Environment environment;

    public EnvironmentOverrideSource(Environment environment) {
        this.environment = environment;
    }

    @Override
    public Optional<String> lookup(String key) {
        return Optional.ofNullable(environment.getProperty(key));
    }
}
