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
import java.util.List;
import java.util.Map;

@Lazy
@Component
public class ListDevicesOperation implements Operation {

    private static final Map<String, String> TYPES = Map.of("uap", "ap", "usw", "switch", "ugw", "gateway", "udm", "gateway");

    private static final OperationDescriptor DESCRIPTOR = OperationDescriptor.of(
            "list_devices",
            "List adopted network devices, optionally filtered by type.",
            OperationCategory.DEVICES, OperationAction.READ,
            """
            {"type":"object","properties":{
               "device_type":{"type":"string","enum":["all","ap","switch","gateway"]}},
             "additionalProperties":false}
            """,
            ListDevicesOperation.class);

    private final ControllerClient controller;

    public ListDevicesOperation(ControllerClient controller) {
        this.controller = controller;
    }

    @Override public OperationDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public Object execute(Map<String, Object> arguments, OperationContext ctx) {
        String wanted = Args.string(arguments, "device_type", "all");
        List<Map<String, Object>> devices = controller.list(controller.sitePath("/stat/device"));
        return devices.stream()
                .map(ListDevicesOperation::summary)
                .filter(d -> "all".equals(wanted) || wanted.equals(d.get("type")))
                .toList();
    }

    private static Map<String, Object> summary(Map<String, Object> raw) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("mac",     raw.get("mac"));
        d.put("name",    raw.getOrDefault("name", raw.get("mac")));
        d.put("model",   raw.get("model"));
        d.put("type",    TYPES.getOrDefault(String.valueOf(raw.get("type")), String.valueOf(raw.get("type"))));
        d.put("ip",      raw.get("ip"));
        d.put("version", raw.get("version"));
        d.put("state",   Integer.valueOf(1).equals(raw.get("state")) ? "online" : "offline");
        return d;
    }
}
