package com.netpilot.gateway.permission;

import com.netpilot.gateway.support.MapOverrideSource;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Precedence: override > category config > defaults > global default.
 * No Spring context.
 */
class PermissionGateTest {

    MapOverrideSource overrides = new MapOverrideSource();

    PermissionGate gate(boolean globalDefault,
                        Map<String, Boolean> defaults,
                        Map<String, Map<String, Boolean>> categories) {
        return new PermissionGate(
                new PermissionProperties("GATEWAY_PERMISSIONS", globalDefault, defaults, categories), overrides);
    }

    // ------------------------------------------------------------------
    // Layers
    // ------------------------------------------------------------------

    @Test
    void nothingConfigured_readAllowed_mutatingFollowsGlobalDefault() {
        PermissionGate open = gate(true, Map.of(), Map.of());
        PermissionGate closed = gate(false, Map.of(), Map.of());

        assertThat(open.allowed(OperationCategory.NETWORKS, OperationAction.CREATE)).isTrue();
        assertThat(closed.allowed(OperationCategory.NETWORKS, OperationAction.CREATE)).isFalse();
        assertThat(closed.allowed(OperationCategory.NETWORKS, OperationAction.READ)).isTrue();
    }

    @Test
    void defaultsBlock_beatsGlobalDefault() {
        PermissionGate gate = gate(true, Map.of("update", false), Map.of());

        assertThat(gate.allowed(OperationCategory.WLANS, OperationAction.UPDATE)).isFalse();
        assertThat(gate.allowed(OperationCategory.WLANS, OperationAction.CREATE)).isTrue();
    }

    @Test
    void categoryConfig_beatsDefaults() {
        PermissionGate gate = gate(true, Map.of("update", false),
                Map.of("vpn_servers", Map.of("update", true)));

        assertThat(gate.allowed(OperationCategory.VPN_SERVERS, OperationAction.UPDATE)).isTrue();
        assertThat(gate.allowed(OperationCategory.VPN_CLIENTS, OperationAction.UPDATE)).isFalse();
    }

    @Test
    void override_beatsCategoryConfig() {
        PermissionGate gate = gate(true, Map.of(), Map.of("networks", Map.of("create", false)));
        overrides.set("GATEWAY_PERMISSIONS_NETWORKS_CREATE", "yes");

        assertThat(gate.allowed(OperationCategory.NETWORKS, OperationAction.CREATE)).isTrue();
    }

    @Test
    void override_nonTruthyValue_denies() {
        PermissionGate gate = gate(true, Map.of(), Map.of());
        overrides.set("GATEWAY_PERMISSIONS_DEVICES_UPDATE", "nope");

        assertThat(gate.allowed(OperationCategory.DEVICES, OperationAction.UPDATE)).isFalse();
    }

    @Test
    void override_canDenyRead() {
        PermissionGate gate = gate(true, Map.of(), Map.of());
        overrides.set("GATEWAY_PERMISSIONS_CLIENTS_READ", "false");

        assertThat(gate.allowed(OperationCategory.CLIENTS, OperationAction.READ)).isFalse();
    }

    // ------------------------------------------------------------------
    // Delete follows update
    // ------------------------------------------------------------------

    @Test
    void delete_followsUpdateRule_atEveryLevel() {
        PermissionGate gate = gate(true, Map.of(), Map.of("networks", Map.of("update", false)));
        assertThat(gate.allowed(OperationCategory.NETWORKS, OperationAction.DELETE)).isFalse();

        overrides.set("GATEWAY_PERMISSIONS_NETWORKS_UPDATE", "1");
        assertThat(gate.allowed(OperationCategory.NETWORKS, OperationAction.DELETE)).isTrue();
    }

    @Test
    void overrideKey_usesUpdateForDelete() {
        PermissionGate gate = gate(true, Map.of(), Map.of());

        assertThat(gate.overrideKey(OperationCategory.TRAFFIC_ROUTES, OperationAction.DELETE))
                .isEqualTo("GATEWAY_PERMISSIONS_TRAFFIC_ROUTES_UPDATE");
    }

    @Test
    void configuredDeleteKey_isIgnored() {
        PermissionGate gate = gate(true, Map.of(), Map.of("networks", Map.of("delete", true, "update", false)));

        assertThat(gate.allowed(OperationCategory.NETWORKS, OperationAction.DELETE)).isFalse();
    }

    // ------------------------------------------------------------------
    // Startup validation
    // ------------------------------------------------------------------

    @Test
    void unknownCategoryKey_failsAtConstruction() {
        assertThatThrownBy(() -> gate(true, Map.of(), Map.of("netwrks", Map.of("create", true))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("netwrks");
    }

    @Test
    void unknownActionKey_failsAtConstruction() {
        assertThatThrownBy(() -> gate(true, Map.of("destroy", true), Map.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("destroy");
    }

    @Test
    void hyphenatedAndStrippedCategoryKeys_areAccepted() {
        PermissionGate gate = gate(true, Map.of(),
                Map.of("port-forwards", Map.of("update", false), "trafficroutes", Map.of("update", false)));

        assertThat(gate.allowed(OperationCategory.PORT_FORWARDS, OperationAction.UPDATE)).isFalse();
        assertThat(gate.allowed(OperationCategory.TRAFFIC_ROUTES, OperationAction.UPDATE)).isFalse();
    }
}
