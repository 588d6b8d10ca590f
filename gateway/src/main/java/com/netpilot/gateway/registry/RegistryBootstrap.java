package com.netpilot.gateway.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netpilot.gateway.operation.Operation;
import com.netpilot.gateway.operation.OperationDescriptor;
import com.netpilot.gateway.permission.OperationCategory;
import com.netpilot.gateway.permission.PermissionGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the {@link OperationRegistry} once at startup.
 *
 * <ul>
 *   <li>EAGER: every handler from the {@link HandlerSource} is instantiated and
 *       registered with its permission status fixed immediately.</li>
 *   <li>LAZY: descriptors come from the static manifest; no handler is touched
 *       until its first call.</li>
 * </ul>
 *
 * The {@code enabled-categories} / {@code enabled-tools} filters drop
 * operations from the registry entirely, so they are not even discoverable.
 */
public class RegistryBootstrap {

    private static final Logger log = LoggerFactory.getLogger(RegistryBootstrap.class);

    private final RegistryProperties properties;
    private final PermissionGate     gate;
    private final HandlerSource      handlers;
    private final OperationLoader    loader;
    private final ResourceLoader     resources;
    private final ObjectMapper       json;

    public RegistryBootstrap(RegistryProperties properties,
                             PermissionGate gate,
                             HandlerSource handlers,
                             OperationLoader loader,
                             ResourceLoader resources,
                             ObjectMapper json) {
        this.properties = properties;
        this.gate       = gate;
        this.handlers   = handlers;
        this.loader     = loader;
        this.resources  = resources;
        this.json       = json;
    }

    public OperationRegistry build() {
        OperationRegistry registry = new OperationRegistry(gate, loader);
        Set<OperationCategory> categories = enabledCategories();
        Set<String> tools = Set.copyOf(properties.enabledTools());

        int skipped = 0;
        if (properties.mode() == RegistrationMode.EAGER) {
            for (Operation handler : handlers.handlers()) {
                if (enabled(handler.descriptor(), categories, tools)) {
                    registry.register(handler);
                } else {
                    skipped++;
                }
            }
        } else {
            for (OperationDescriptor descriptor : readManifest()) {
                if (enabled(descriptor, categories, tools)) {
                    registry.registerDeferred(descriptor, properties.precheckPermissions());
                } else {
                    skipped++;
                }
            }
        }

        long callable = registry.snapshot().stream().filter(RegistryEntry::isCallable).count();
        log.info("Operation registry ready ({} mode): {} operations, {} callable, {} filtered out",
                properties.mode(), registry.size(), callable, skipped);
        return registry;
    }

    List<OperationDescriptor> readManifest() {
        Resource manifest = resources.getResource(properties.manifest());
        try (InputStream in = manifest.getInputStream()) {
            List<OperationDescriptor> descriptors = OperationManifest.read(in, json);
            log.info("Read {} operation descriptors from {}", descriptors.size(), properties.manifest());
            return descriptors;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read tool manifest " + properties.manifest(), e);
        }
    }

    private Set<OperationCategory> enabledCategories() {
        Set<OperationCategory> enabled = EnumSet.noneOf(OperationCategory.class);
        properties.enabledCategories().forEach(key -> enabled.add(OperationCategory.fromKey(key)));
        return enabled;
    }

    private static boolean enabled(OperationDescriptor d, Set<OperationCategory> categories, Set<String> tools) {
        if (!categories.isEmpty() && !categories.contains(d.category())) {
            return false;
        }
        return tools.isEmpty() || tools.contains(d.name());
    }
}
