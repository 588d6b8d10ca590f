package com.netpilot.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netpilot.gateway.permission.PermissionGate;
import com.netpilot.gateway.registry.HandlerSource;
import com.netpilot.gateway.registry.OperationLoader;
import com.netpilot.gateway.registry.OperationRegistry;
import com.netpilot.gateway.registry.RegistryBootstrap;
import com.netpilot.gateway.registry.RegistryProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * The registry is built exactly once, before any request is served, and
 * injected wherever it is needed.
 */
@Configuration
public class RegistryConfiguration {

    @Bean
    public OperationRegistry operationRegistry(RegistryProperties properties,
                                               PermissionGate gate,
                                               HandlerSource handlers,
                                               OperationLoader loader,
                                               ResourceLoader resources,
                                               ObjectMapper json) {
        return new RegistryBootstrap(properties, gate, handlers, loader, resources, json).build();
    }
}
