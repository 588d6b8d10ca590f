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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Lazy
@Component
public class CreateNetworkOperation implements MutatingOperation {

    private static final OperationDescriptor DESCRIPTOR = OperationDescriptor.of(
            "create_network",
            "Create a new network. Requires confirm=true to apply.",
            OperationCategory.NETWORKS, OperationAction.CREATE,
            """
            {"type":"object","properties":{
               "name":{"type":"string","minLength":1},
               "purpose":{"type":"string","enum":["corporate","guest","vlan-only"]},
               "vlan":{"type":"integer","minimum":1,"maximum":4094},
               "ip_subnet":{"type":"string"},
               "dhcp_enabled":{"type":"boolean"}},
             "required":["name","purpose"],"additionalProperties":false}
            """,
            CreateNetworkOperation.class);

    private final ControllerClient controller;

    public CreateNetworkOperation(ControllerClient controller) {
        this.controller = controller;
    }

    @Override public OperationDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public Preview preview(Map<String, Object> arguments, OperationContext ctx) {
        List<String> warnings = new ArrayList<>();
        if (!"vlan-only".equals(arguments.get("purpose")) && arguments.get("ip_subnet") == null) {
            warnings.add("No ip_subnet given; the controller will pick one");
        }
        if (arguments.get("vlan") == null) {
            warnings.add("No vlan given; the network will be untagged");
        }
        return Preview.create("network", body(arguments), Args.string(arguments, "name"), warnings);
    }

    @Override
    public Object execute(Map<String, Object> arguments, OperationContext ctx) {
        Map<String, Object> created = controller.create(controller.sitePath(ListNetworksOperation.PATH), body(arguments));
        return Map.of("id", String.valueOf(created.get("_id")), "name", Args.string(arguments, "name"));
    }

    private static Map<String, Object> body(Map<String, Object> arguments) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", arguments.get("name"));
        body.put("purpose", arguments.get("purpose"));
        if (arguments.get("vlan") != null) {
            body.put("vlan_enabled", true);
            body.put("vlan", arguments.get("vlan"));
        }
        if (arguments.get("ip_subnet") != null) body.put("ip_subnet", arguments.get("ip_subnet"));
        body.put("dhcpd_enabled", arguments.getOrDefault("dhcp_enabled", Boolean.TRUE));
        return body;
    }
}
