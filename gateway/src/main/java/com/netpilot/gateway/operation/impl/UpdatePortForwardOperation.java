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

/**
 * Partial update of a port-forward rule. Only the keys in {@code updates}
 * change; the rest of the rule is sent back as read.
 */
@Lazy
@Component
public class UpdatePortForwardOperation implements MutatingOperation {

    private static final String PATH = "/rest/portforward";

    private static final OperationDescriptor DESCRIPTOR = OperationDescriptor.of(
            "update_port_forward",
            "Update fields of a port forwarding rule. Requires confirm=true to apply.",
            OperationCategory.PORT_FORWARDS, OperationAction.UPDATE,
            """
            {"type":"object","properties":{
               "rule_id":{"type":"string","minLength":1},
               "updates":{"type":"object","minProperties":1,"properties":{
                   "name":{"type":"string"},
                   "enabled":{"type":"boolean"},
                   "dst_port":{"type":"string"},
                   "fwd":{"type":"string"},
                   "fwd_port":{"type":"string"},
                   "proto":{"type":"string","enum":["tcp","udp","tcp_udp"]}},
                 "additionalProperties":false}},
             "required":["rule_id","updates"],"additionalProperties":false}
            """,
            UpdatePortForwardOperation.class);

    private final ControllerClient controller;

    public UpdatePortForwardOperation(ControllerClient controller) {
        this.controller = controller;
    }

    @Override public OperationDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public Preview preview(Map<String, Object> arguments, OperationContext ctx) {
        String id = Args.string(arguments, "rule_id");
        Map<String, Object> rule = lookup(id);
        return Preview.update("port_forward", id, (String) rule.get("name"), rule, Args.object(arguments, "updates"));
    }

    @Override
    public Object execute(Map<String, Object> arguments, OperationContext ctx) {
        String id = Args.string(arguments, "rule_id");
        Map<String, Object> updates = Args.object(arguments, "updates");
        Map<String, Object> rule = new LinkedHashMap<>(lookup(id));
        rule.putAll(updates);
        controller.update(controller.sitePath(PATH + "/" + id), rule);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("rule_id", id);
        result.put("updated", List.copyOf(updates.keySet()));
        return result;
    }

    private Map<String, Object> lookup(String id) {
        return controller.find(controller.sitePath(PATH), "_id", id)
                .orElseThrow(() -> Args.notFound("port forward", id));
    }
}
