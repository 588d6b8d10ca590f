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
import java.util.Locale;
import java.util.Map;

@Lazy
@Component
public class GetClientStatsOperation implements Operation {

    private static final OperationDescriptor DESCRIPTOR = OperationDescriptor.of(
            "get_client_stats",
            "Get traffic and signal statistics for one connected client.",
            OperationCategory.STATS, OperationAction.READ,
            """
            {"type":"object","properties":{
               "mac":{"type":"string","pattern":"^([0-9A-Fa-f]{2}:){5}[0-9A-Fa-f]{2}$"}},
             "required":["mac"],"additionalProperties":false}
            """,
            GetClientStatsOperation.class);

    private final ControllerClient controller;

    public GetClientStatsOperation(ControllerClient controller) {
        this.controller = controller;
    }

    @Override public OperationDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public Object execute(Map<String, Object> arguments, OperationContext ctx) {
        String mac = Args.string(arguments, "mac").toLowerCase(Locale.ROOT);
        Map<String, Object> client = controller.find(controller.sitePath("/stat/sta"), "mac", mac)
                .orElseThrow(() -> Args.notFound("client", mac));

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("mac",      mac);
        stats.put("hostname", client.get("hostname"));
        stats.put("ip",       client.get("ip"));
        stats.put("rx_bytes", client.get("rx_bytes"));
        stats.put("tx_bytes", client.get("tx_bytes"));
        stats.put("signal",   client.get("signal"));
        stats.put("uptime",   client.get("uptime"));
        return stats;
    }
}
