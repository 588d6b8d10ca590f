package com.netpilot.gateway.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netpilot.gateway.controller.ControllerClient;
import com.netpilot.gateway.operation.Operation;
import com.netpilot.gateway.operation.OperationDescriptor;
import com.netpilot.gateway.operation.impl.CreateNetworkOperation;
import com.netpilot.gateway.operation.impl.DeleteNetworkOperation;
import com.netpilot.gateway.operation.impl.GetClientStatsOperation;
import com.netpilot.gateway.operation.impl.GetNetworkHealthOperation;
import com.netpilot.gateway.operation.impl.ListDevicesOperation;
import com.netpilot.gateway.operation.impl.ListNetworksOperation;
import com.netpilot.gateway.operation.impl.ListTrafficRoutesOperation;
import com.netpilot.gateway.operation.impl.ToggleTrafficRouteOperation;
import com.netpilot.gateway.operation.impl.UpdatePortForwardOperation;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class OperationManifestTest {

    ObjectMapper json = new ObjectMapper();

    static List<OperationDescriptor> handlerDescriptors() {
        ControllerClient controller = mock(ControllerClient.class);
        List<Operation> handlers = List.of(
                new ListDevicesOperation(controller),
                new GetNetworkHealthOperation(controller),
                new GetClientStatsOperation(controller),
                new ListNetworksOperation(controller),
                new CreateNetworkOperation(controller),
                new DeleteNetworkOperation(controller),
                new ListTrafficRoutesOperation(controller),
                new ToggleTrafficRouteOperation(controller),
                new UpdatePortForwardOperation(controller));
        return handlers.stream()
                .map(Operation::descriptor)
                .sorted(Comparator.comparing(OperationDescriptor::name))
                .toList();
    }

    @Test
    void shippedManifest_describesEveryHandlerExactly() throws Exception {
        List<OperationDescriptor> fromManifest;
        try (InputStream in = getClass().getResourceAsStream("/tools-manifest.json")) {
            fromManifest = OperationManifest.read(in, json);
        }

        assertThat(fromManifest).containsExactlyInAnyOrderElementsOf(handlerDescriptors());
    }

    @Test
    void shippedManifest_carriesOutputSchemaWhereHandlerDeclaresOne() throws Exception {
        List<OperationDescriptor> fromManifest;
        try (InputStream in = getClass().getResourceAsStream("/tools-manifest.json")) {
            fromManifest = OperationManifest.read(in, json);
        }

        OperationDescriptor health = fromManifest.stream()
                .filter(d -> d.name().equals("get_network_health"))
                .findFirst().orElseThrow();
        assertThat(health.outputSchema()).isNotNull();
        assertThat(health.outputSchema().at("/additionalProperties/type").asText()).isEqualTo("string");
    }

    @Test
    void write_thenRead_givesSameDescriptors() throws Exception {
        List<OperationDescriptor> descriptors = handlerDescriptors();
        String text = OperationManifest.write(descriptors, json);

        List<OperationDescriptor> reread = OperationManifest.read(
                new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)), json);

        assertThat(reread).isEqualTo(descriptors);
        assertThat(json.readTree(text).get("count").asInt()).isEqualTo(descriptors.size());
    }

    @Test
    void unknownCategory_rejectedWithEntryName() {
        String text = """
                {"tools":[{"name":"x","category":"toasters","action":"read","handler":"a.B"}],"count":1}
                """;

        assertThatThrownBy(() -> OperationManifest.read(stream(text), json))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'x'")
                .hasMessageContaining("toasters");
    }

    @Test
    void countMismatch_rejected() {
        String text = """
                {"tools":[{"name":"x","category":"stats","action":"read","handler":"a.B"}],"count":2}
                """;

        assertThatThrownBy(() -> OperationManifest.read(stream(text), json))
                .hasMessageContaining("count 2");
    }

    @Test
    void missingSchema_defaultsToEmptyObjectSchema() throws Exception {
        String text = """
                {"tools":[{"name":"x","category":"stats","action":"read","handler":"a.B"}]}
                """;

        OperationDescriptor d = OperationManifest.read(stream(text), json).get(0);

        assertThat(d.inputSchema().get("type").asText()).isEqualTo("object");
        assertThat(d.outputSchema()).isNull();
    }

    private static InputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
