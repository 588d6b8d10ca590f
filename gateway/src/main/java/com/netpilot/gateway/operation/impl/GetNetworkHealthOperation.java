package com.netpilot.gateway.operation.impl;

import com.netpilot.gateway.controller.ControllerClient;
import com.netpilot.gateway.operation.Operation;
import com.netpilot.gateway.operation.OperationContext;
import com.netpilot.gateway.operation.OperationDescriptor;
import com.netpilot.gateway.permission.OperationAction;
import com.netpilot.gateway.permission.OperationCategory;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/** Per-subsystem (wan, lan, wlan, vpn) health of the site. */
@Lazy
@Component
public class GetNetworkHealthOperation implements Operation {

    private static final OperationDescriptor DESCRIPTOR = OperationDescriptor.of(
            "get_network_health",
            "Get the health status of each network subsystem.",
            OperationCategory.SYSTEM, OperationAction.READ,
            """
            {"type":"object","properties":{},"additionalProperties":false}
            """,
            GetNetworkHealthOperation.class)
            .withOutputSchema("""
                    {"type":"object","additionalProperties":{"type":"string"}}
                    """);

    private final ControllerClient controller;

    public GetNetworkHealthOperation(ControllerClient controller) {
        this.controller = controller;
    }

    @Override public OperationDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public Object execute(Map<String, Object> arguments, OperationContext ctx) {
        Map<String, Object> health = new LinkedHashMap<>();
        for (Map<String, Object> subsystem : controller.list(controller.sitePath("/stat/health"))) {
            health.put(String.valueOf(subsystem.get("subsystem")), subsystem.getOrDefault("status", "unknown"));
        }
        return health;
    }
}
