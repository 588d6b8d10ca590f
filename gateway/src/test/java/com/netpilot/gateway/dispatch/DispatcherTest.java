package com.netpilot.gateway.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.netpilot.gateway.confirmation.Preview;
import com.netpilot.gateway.operation.MutatingOperation;
import com.netpilot.gateway.operation.Operation;
import com.netpilot.gateway.operation.OperationContext;
import com.netpilot.gateway.operation.OperationDescriptor;
import com.netpilot.gateway.operation.OperationException;
import com.netpilot.gateway.permission.OperationAction;
import com.netpilot.gateway.permission.OperationCategory;
import com.netpilot.gateway.support.TestGateway;
import com.netpilot.gateway.support.TestOperations.Broken;
import com.netpilot.gateway.support.TestOperations.NetCreate;
import com.netpilot.gateway.support.TestOperations.StatRead;
import com.netpilot.gateway.support.TestOperations.ToggleRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Dispatch through the real registry, gate, validator and confirmation
 * protocol. No Spring context.
 */
class DispatcherTest {

    TestGateway gw;
    StatRead statRead;
    NetCreate netCreate;
    ToggleRule toggleRule;

    @BeforeEach
    void setUp() {
        gw = TestGateway.standard();
        statRead   = new StatRead();
        netCreate  = new NetCreate();
        toggleRule = new ToggleRule();
        gw.registry.register(statRead);
        gw.registry.register(netCreate);
        gw.registry.register(toggleRule);
        gw.registry.register(new Broken());
    }

    // ------------------------------------------------------------------
    // Permission visibility
    // ------------------------------------------------------------------

    @Test
    void allowedRead_succeeds_deniedCreate_refused() {
        DispatchResult ok = gw.dispatcher.dispatch("stat_read", Map.of());
        DispatchResult denied = gw.dispatcher.dispatch("net_create", Map.of("name", "iot", "confirm", true));

        assertThat(ok.success()).isTrue();
        assertThat(ok.data()).isEqualTo(Map.of("metric", "uptime", "value", 42));
        assertThat(denied.success()).isFalse();
        assertThat(denied.errorType()).isEqualTo("permission_denied");
        assertThat(denied.error()).contains("networks/create");
        assertThat(netCreate.executions).hasValue(0);
    }

    @Test
    void deniedOperation_refusedForAnyArguments() {
        for (Map<String, Object> args : List.<Map<String, Object>>of(
                Map.of(), Map.of("name", "x"), Map.of("name", 5), Map.of("confirm", "true"))) {
            assertThat(gw.dispatcher.dispatch("net_create", args).errorType()).isEqualTo("permission_denied");
        }
    }

    @Test
    void unknownOperation_isStructuredFailure() {
        DispatchResult result = gw.dispatcher.dispatch("does_not_exist", Map.of());

        assertThat(result.success()).isFalse();
        assertThat(result.errorType()).isEqualTo("unknown_operation");
        assertThat(result.error()).contains("does_not_exist");
        assertThat(gw.meters.counter("gateway.operation.calls", "operation", "unknown",
                "outcome", "unknown_operation").count()).isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Confirmation
    // ------------------------------------------------------------------

    @Test
    void toggle_previewThenConfirm() {
        DispatchResult preview = gw.dispatcher.dispatch("toggle_rule", Map.of("id", "x"));

        assertThat(preview.success()).isFalse();
        assertThat(preview.isConfirmationRequired()).isTrue();
        assertThat(preview.action()).isEqualTo("toggle");
        assertThat(preview.resourceType()).isEqualTo("rule");
        assertThat(preview.resourceId()).isEqualTo("x");
        assertThat(preview.preview().current()).isEqualTo(Map.of("enabled", true));
        assertThat(preview.preview().proposed()).isEqualTo(Map.of("enabled", false));
        assertThat(toggleRule.executions).hasValue(0);

        DispatchResult done = gw.dispatcher.dispatch("toggle_rule", Map.of("id", "x", "confirm", true));

        assertThat(done.success()).isTrue();
        assertThat(done.data()).isEqualTo(Map.of("enabled", false));
        assertThat(toggleRule.executions).hasValue(1);
    }

    @Test
    void repeatedPreview_isIdenticalAndSideEffectFree() {
        DispatchResult a = gw.dispatcher.dispatch("toggle_rule", Map.of("id", "x", "confirm", false));
        DispatchResult b = gw.dispatcher.dispatch("toggle_rule", Map.of("id", "x", "confirm", false));

        assertThat(a).isEqualTo(b);
        assertThat(toggleRule.enabled).isEmpty();
    }

    @Test
    void confirmationResponse_serializesWithSnakeCaseAndNoNulls() {
        JsonNode node = gw.json.valueToTree(gw.dispatcher.dispatch("toggle_rule", Map.of("id", "x")));

        assertThat(node.get("success").asBoolean()).isFalse();
        assertThat(node.get("requires_confirmation").asBoolean()).isTrue();
        assertThat(node.get("resource_type").asText()).isEqualTo("rule");
        assertThat(node.at("/preview/proposed/enabled").asBoolean()).isFalse();
        assertThat(node.has("data")).isFalse();
        assertThat(node.has("error")).isFalse();
        assertThat(node.has("warnings")).isFalse();
    }

    @Test
    void autoConfirm_executesWithoutPreview() {
        TestGateway auto = new TestGateway(true);
        ToggleRule rule = new ToggleRule();
        auto.registry.register(rule);

        DispatchResult result = auto.dispatcher.dispatch("toggle_rule", Map.of("id", "x"));

        assertThat(result.success()).isTrue();
        assertThat(rule.executions).hasValue(1);
    }

    // ------------------------------------------------------------------
    // Validation and handler failures
    // ------------------------------------------------------------------

    @Test
    void invalidArguments_rejectedBeforePreview() {
        DispatchResult result = gw.dispatcher.dispatch("toggle_rule", Map.of("id", 12));

        assertThat(result.errorType()).isEqualTo("validation_error");
        assertThat(toggleRule.executions).hasValue(0);
    }

    @Test
    void confirmIsNotSeenByValidator() {
        // toggle_rule forbids additional properties
        assertThat(gw.dispatcher.dispatch("toggle_rule", Map.of("id", "x", "confirm", "yes")).success()).isTrue();
    }

    @Test
    void handlerException_becomesHandlerError() {
        DispatchResult result = gw.dispatcher.dispatch("broken", Map.of());

        assertThat(result.success()).isFalse();
        assertThat(result.errorType()).isEqualTo("handler_error");
        assertThat(result.error()).contains("controller unreachable");
    }

    @Test
    void handlerError_becomesHandlerError() {
        gw.registry.register(new Operation() {
            @Override public OperationDescriptor descriptor() {
                return OperationDescriptor.of("recursive", "Overflows.", OperationCategory.SYSTEM,
                        OperationAction.READ, null, Operation.class);
            }

            @Override public Object execute(Map<String, Object> arguments, OperationContext ctx) {
                throw new StackOverflowError("deep");
            }
        });

        DispatchResult result = gw.dispatcher.dispatch("recursive", Map.of());

        assertThat(result.success()).isFalse();
        assertThat(result.errorType()).isEqualTo("handler_error");
        assertThat(result.error()).contains("deep");
        assertThat(gw.meters.counter("gateway.operation.calls", "operation", "recursive",
                "outcome", "handler_error").count()).isEqualTo(1.0);
    }

    @Test
    void mutatingHandlerWithoutPreviewResult_isHandlerError_andNeverExecutes() {
        AtomicInteger executions = new AtomicInteger();
        gw.registry.register(new MutatingOperation() {
            @Override public OperationDescriptor descriptor() {
                return OperationDescriptor.of("silent_update", "Previews nothing.", OperationCategory.TRAFFIC_ROUTES,
                        OperationAction.UPDATE, null, MutatingOperation.class);
            }

            @Override public Preview preview(Map<String, Object> arguments, OperationContext ctx) {
                return null;
            }

            @Override public Object execute(Map<String, Object> arguments, OperationContext ctx) {
                executions.incrementAndGet();
                return Map.of();
            }
        });

        DispatchResult result = gw.dispatcher.dispatch("silent_update", Map.of());

        assertThat(result.success()).isFalse();
        assertThat(result.isConfirmationRequired()).isFalse();
        assertThat(result.errorType()).isEqualTo("handler_error");
        assertThat(result.error()).contains("returned no preview");
        assertThat(executions).hasValue(0);
    }

    @Test
    void prepare_throwsInsteadOfReturningFailure() {
        assertThatThrownBy(() -> gw.dispatcher.prepare("net_create", Map.of(), OperationContext.direct()))
                .isInstanceOf(OperationException.class);
    }

    // ------------------------------------------------------------------
    // Metrics
    // ------------------------------------------------------------------

    @Test
    void everyCall_isCountedByOutcome_andTimed() {
        gw.dispatcher.dispatch("stat_read", Map.of());
        gw.dispatcher.dispatch("stat_read", Map.of());
        gw.dispatcher.dispatch("toggle_rule", Map.of("id", "x"));
        gw.dispatcher.dispatch("net_create", Map.of("name", "x"));

        assertThat(gw.meters.counter("gateway.operation.calls", "operation", "stat_read", "outcome", "success").count())
                .isEqualTo(2.0);
        assertThat(gw.meters.counter("gateway.operation.calls", "operation", "toggle_rule",
                "outcome", "confirmation_required").count()).isEqualTo(1.0);
        assertThat(gw.meters.counter("gateway.operation.calls", "operation", "net_create",
                "outcome", "permission_denied").count()).isEqualTo(1.0);
        assertThat(gw.meters.timer("gateway.operation.duration", "operation", "stat_read", "category", "stats").count())
                .isEqualTo(2);
    }
}
