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
public class ListTrafficRoutesOperation implements Operation {

    static final String PATH = "/trafficroutes";

    private static final OperationDescriptor DESCRIPTOR = OperationDescriptor.of(
            "list_traffic_routes",
            "List policy-based traffic routes.",
            OperationCategory.TRAFFIC_ROUTES, OperationAction.READ,
            """
            {"type":"object","properties":{},"additionalProperties":false}
            """,
            ListTrafficRoutesOperation.class);

    private final ControllerClient controller;

    public ListTrafficRoutesOperation(ControllerClient controller) {
        this.controller = controller;
    }

    @Override public OperationDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public Object execute(Map<String, Object> arguments, OperationContext ctx) {
        return controller.list(controller.v2SitePath(PATH)).stream()
                .map(r -> {
                    Map<String, Object> view = new LinkedHashMap<>();
                    view.put("id",              r.get("_id"));
                    view.put("description",     r.get("description"));
                    view.put("enabled",         r.get("enabled"));
                    view.put("matching_target", r.get("matching_target"));
                    view.put("interface",       r.get("network_id"));
                    return view;
                })
                .toList();
    }
}
