package com.netpilot.gateway.confirmation;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PreviewTest {

    @Test
    void toggle_proposesInvertedEnabled() {
        Preview p = Preview.toggle("traffic_route", "r1", "Office VPN", false, Map.of("matching_target", "DOMAIN"));

        assertThat(p.action()).isEqualTo("toggle");
        assertThat(p.current()).containsEntry("enabled", false).containsEntry("matching_target", "DOMAIN");
        assertThat(p.proposed()).containsExactly(Map.entry("enabled", true));
        assertThat(p.message()).startsWith("Will enable traffic_route 'Office VPN'").endsWith("Set confirm=true to execute.");
    }

    @Test
    void update_narrowsCurrentToChangedKeys() {
        Map<String, Object> current = Map.of("name", "ssh", "dst_port", "22", "fwd", "10.0.0.5");

        Preview p = Preview.update("port_forward", "pf1", "ssh", current, Map.of("dst_port", "2222"));

        assertThat(p.current()).containsExactly(Map.entry("dst_port", "22"));
        assertThat(p.proposed()).containsExactly(Map.entry("dst_port", "2222"));
    }

    @Test
    void update_unsetCurrentField_isShownAsNull() {
        Preview p = Preview.update("port_forward", "pf1", null, new HashMap<>(), Map.of("fwd_port", "80"));

        assertThat(p.current()).containsEntry("fwd_port", null);
    }

    @Test
    void create_hasNoCurrentState_andKeepsWarnings() {
        Preview p = Preview.create("network", Map.of("name", "iot"), "iot", List.of("untagged"));

        assertThat(p.current()).isEmpty();
        assertThat(p.resourceId()).isNull();
        assertThat(p.warnings()).containsExactly("untagged");
        assertThat(p.message()).contains("create network 'iot'");
    }
}
