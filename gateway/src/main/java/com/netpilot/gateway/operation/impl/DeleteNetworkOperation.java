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
import java.util.List;
import java.util.Map;

/** Governed by the networks/update permission, like every delete. */
@Lazy
@Component
public class DeleteNetworkOperation implements MutatingOperation {

    private static final OperationDescriptor DESCRIPTOR = OperationDescriptor.of(
            "delete_network",
            "Delete a network. Requires confirm=true to apply.",
            OperationCategory.NETWORKS, OperationAction.DELETE,
            """
            {"type":"object","properties":{
               "network_id":{"type":"string","minLength":1}},
             "required":["network_id"],"additionalProperties":false}
            """,
            DeleteNetworkOperation.class);

    private final ControllerClient controller;

    public DeleteNetworkOperation(ControllerClient controller) {
        this.controller = controller;
    }

    @Override public OperationDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public Preview preview(Map<String, Object> arguments, OperationContext ctx) {
        String id = Args.string(arguments, "network_id");
        Map<String, Object> network = lookup(id);

        Map<String, Object> current = new LinkedHashMap<>();
        current.put("name",      network.get("name"));
        current.put("purpose",   network.get("purpose"));
        current.put("vlan",      network.get("vlan"));
        current.put("ip_subnet", network.get("ip_subnet"));
        return Preview.delete("network", id, (String) network.get("name"), current,
                List.of("Clients on this network will lose connectivity"));
    }

    @Override
    public Object execute(Map<String, Object> arguments, OperationContext ctx) {
        String id = Args.string(arguments, "network_id");
        lookup(id);
        controller.delete(controller.sitePath(ListNetworksOperation.PATH + "/" + id));
        return Map.of("deleted", id);
    }

    private Map<String, Object> lookup(String id) {
        return controller.find(controller.sitePath(ListNetworksOperation.PATH), "_id", id)
                .orElseThrow(() -> Args.notFound("network", id));
    }
}
