package com.netpilot.gateway.operation.impl;

import com.netpilot.gateway.confirmation.Preview;
import com.netpilot.gateway.controller.ControllerClient;
import com.netpilot.gateway.operation.OperationContext;
import com.netpilot.gateway.operation.OperationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ToggleTrafficRouteOperationTest {

    static final String ROUTES = "/v2/api/site/default/trafficroutes";

    @Mock ControllerClient controller;

    ToggleTrafficRouteOperation toggle;
    OperationContext ctx = OperationContext.direct();

    @BeforeEach
    void setUp() {
        toggle = new ToggleTrafficRouteOperation(controller);
        lenient().when(controller.v2SitePath(anyString())).thenAnswer(inv -> "/v2/api/site/default" + inv.getArgument(0));
    }

    @Test
    void preview_readsCurrentState_andWritesNothing() {
        when(controller.find(ROUTES, "_id", "r1")).thenReturn(Optional.of(
                Map.of("_id", "r1", "description", "Office VPN", "enabled", true, "matching_target", "DOMAIN")));

        Preview preview = toggle.preview(Map.of("route_id", "r1"), ctx);

        assertThat(preview.resourceName()).isEqualTo("Office VPN");
        assertThat(preview.current()).containsEntry("enabled", true).containsEntry("matching_target", "DOMAIN");
        assertThat(preview.proposed()).containsEntry("enabled", false);
        verify(controller, never()).update(anyString(), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void execute_flipsEnabled_andPutsWholeRoute() {
        when(controller.find(ROUTES, "_id", "r1")).thenReturn(Optional.of(
                Map.of("_id", "r1", "description", "Office VPN", "enabled", true)));

        Object result = toggle.execute(Map.of("route_id", "r1"), ctx);

        ArgumentCaptor<Map<String, Object>> body = ArgumentCaptor.forClass(Map.class);
        verify(controller).update(eq(ROUTES + "/r1"), body.capture());
        assertThat(body.getValue()).containsEntry("enabled", false).containsEntry("description", "Office VPN");
        assertThat(result).isEqualTo(Map.of("route_id", "r1", "enabled", false));
    }

    @Test
    void unknownRoute_isHandlerError() {
        when(controller.find(ROUTES, "_id", "nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> toggle.preview(Map.of("route_id", "nope"), ctx))
                .isInstanceOf(OperationException.class)
                .hasMessageContaining("traffic route 'nope' not found");
    }

    @Test
    void descriptor_isTrafficRoutesUpdate() {
        assertThat(toggle.descriptor().isMutating()).isTrue();
        assertThat(toggle.descriptor().category().key()).isEqualTo("traffic_routes");
        assertThat(List.of(toggle.descriptor().inputSchema().get("required").get(0).asText())).containsExactly("route_id");
    }
}
