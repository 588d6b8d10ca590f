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

@Lazy
@Component
public class ListNetworksOperation implements Operation {

    static final String PATH = "/rest/networkconf";

    private static final OperationDescriptor DESCRIPTOR = OperationDescriptor.of(
            "list_networks",
            "List configured networks (LAN, guest, VLAN-only).",
            OperationCategory.NETWORKS, OperationAction.READ,
            """
            {"type":"object","properties":{},"additionalProperties":false}
            """,
            ListNetworksOperation.class);

    private final ControllerClient controller;

    public ListNetworksOperation(ControllerClient controller) {
        this.controller = controller;
    }

    @Override public OperationDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public Object execute(Map<String, Object> arguments, OperationContext ctx) {
        return controller.list(controller.sitePath(PATH)).stream()
                .map(n -> {
                    Map<String, Object> view = new LinkedHashMap<>();
                    view.put("id",           n.get("_id"));
                    view.put("name",         n.get("name"));
                    view.put("purpose",      n.get("purpose"));
                    view.put("vlan",         n.get("vlan"));
                    view.put("ip_subnet",    n.get("ip_subnet"));
                    view.put("dhcp_enabled", n.get("dhcpd_enabled"));
                    return view;
                })
                .toList();
    }
}
