package com.netpilot.gateway.operation.impl;

import com.netpilot.gateway.confirmation.Preview;
import com.netpilot.gateway.controller.ControllerClient;
import com.netpilot.gateway.operation.MutatingOperation;
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
public class ToggleTrafficRouteOperation implements MutatingOperation {

    private static final OperationDescriptor DESCRIPTOR = OperationDescriptor.of(
            "toggle_traffic_route",
            "Enable or disable a traffic route. Requires confirm=true to apply.",
            OperationCategory.TRAFFIC_ROUTES, OperationAction.UPDATE,
            """
            {"type":"object","properties":{
               "route_id":{"type":"string","minLength":1}},
             "required":["route_id"],"additionalProperties":false}
            """,
            ToggleTrafficRouteOperation.class);

    private final ControllerClient controller;

    public ToggleTrafficRouteOperation(ControllerClient controller) {
        this.controller = controller;
    }

    @Override public OperationDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public Preview preview(Map<String, Object> arguments, OperationContext ctx) {
        String id = Args.string(arguments, "route_id");
        Map<String, Object> route = lookup(id);
        return Preview.toggle("traffic_route", id, (String) route.get("description"),
                Boolean.TRUE.equals(route.get("enabled")),
                Map.of("matching_target", String.valueOf(route.get("matching_target"))));
    }

    @Override
    public Object execute(Map<String, Object> arguments, OperationContext ctx) {
        String id = Args.string(arguments, "route_id");
        Map<String, Object> route = new LinkedHashMap<>(lookup(id));
        boolean enabled = !Boolean.TRUE.equals(route.get("enabled"));
        route.put("enabled", enabled);
        controller.update(controller.v2SitePath(ListTrafficRoutesOperation.PATH + "/" + id), route);
        return Map.of("route_id", id, "enabled", enabled);
    }

    private Map<String, Object> lookup(String id) {
        return controller.find(controller.v2SitePath(ListTrafficRoutesOperation.PATH), "_id", id)
                .orElseThrow(() -> Args.notFound("traffic route", id));
    }
}
