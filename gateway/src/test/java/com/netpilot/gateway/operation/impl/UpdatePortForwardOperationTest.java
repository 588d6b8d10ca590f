package com.netpilot.gateway.operation.impl;

import com.netpilot.gateway.confirmation.Preview;
import com.netpilot.gateway.controller.ControllerClient;
import com.netpilot.gateway.operation.OperationContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UpdatePortForwardOperationTest {

    @Mock ControllerClient controller;

    UpdatePortForwardOperation update;

    @BeforeEach
    void setUp() {
        update = new UpdatePortForwardOperation(controller);
        when(controller.sitePath(anyString())).thenAnswer(inv -> "/api/s/default" + inv.getArgument(0));
        when(controller.find("/api/s/default/rest/portforward", "_id", "pf1")).thenReturn(Optional.of(
                Map.of("_id", "pf1", "name", "ssh", "dst_port", "22", "fwd", "10.0.0.5", "fwd_port", "22")));
    }

    @Test
    void preview_showsOnlyChangedFields() {
        Preview preview = update.preview(Map.of("rule_id", "pf1", "updates", Map.of("dst_port", "2222")), OperationContext.direct());

        assertThat(preview.action()).isEqualTo("update");
        assertThat(preview.current()).containsExactly(Map.entry("dst_port", "22"));
        assertThat(preview.proposed()).containsExactly(Map.entry("dst_port", "2222"));
        assertThat(preview.message()).contains("dst_port").contains("'ssh'");
    }
}
