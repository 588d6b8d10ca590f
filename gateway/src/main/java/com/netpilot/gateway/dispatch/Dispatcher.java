package com.netpilot.gateway.dispatch;

import com.netpilot.gateway.confirmation.ConfirmationProtocol;
import com.netpilot.gateway.confirmation.ConfirmationProtocol.CallArguments;
import com.netpilot.gateway.confirmation.ConfirmationProtocol.Outcome;
import com.netpilot.gateway.operation.OperationContext;
import com.netpilot.gateway.operation.OperationDescriptor;
import com.netpilot.gateway.operation.OperationException;
import com.netpilot.gateway.registry.OperationRegistry;
import com.netpilot.gateway.registry.ResolvedOperation;
import com.netpilot.gateway.validation.ArgumentValidator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;

/**
 * Synchronous single-operation invocation.
 *
 * <p>{@link #dispatch} never throws: unknown names, denied permissions,
 * failed lazy loads, invalid arguments and handler crashes all come back as
 * {@link DispatchResult#failure}. It blocks until the handler returns; there
 * is no per-operation timeout or cancellation.
 *
 * <p>Every call is counted and timed:
 * <pre>
 *   gateway.operation.calls{operation, outcome="success|confirmation_required|permission_denied|..."}
 *   gateway.operation.duration{operation, category}
 * </pre>
 */
@Service
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final OperationRegistry    registry;
    private final ArgumentValidator    validator;
    private final ConfirmationProtocol confirmation;
    private final OperationDiagnostics diagnostics;
    private final MeterRegistry        meterRegistry;

    public Dispatcher(OperationRegistry registry,
                      ArgumentValidator validator,
                      ConfirmationProtocol confirmation,
                      OperationDiagnostics diagnostics,
                      MeterRegistry meterRegistry) {
        this.registry      = registry;
        this.validator     = validator;
        this.confirmation  = confirmation;
        this.diagnostics   = diagnostics;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    public DispatchResult dispatch(String name, Map<String, Object> arguments) {
        return dispatch(name, arguments, OperationContext.direct());
    }

    public DispatchResult dispatch(String name, Map<String, Object> arguments, OperationContext ctx) {
        PreparedCall call;
        try {
            call = prepare(name, arguments, ctx);
        } catch (OperationException e) {
            return rejected(name, arguments, e);
        }
        return call.invoke();
    }

    /**
     * Lookup, lazy load, permission check and argument validation, without
     * running anything.
     *
     * @throws OperationException if any of those steps refuses the call
     */
    public PreparedCall prepare(String name, Map<String, Object> arguments, OperationContext ctx) {
        CallArguments args = ConfirmationProtocol.split(arguments);
        ResolvedOperation resolved = registry.resolveForExecution(name);
        validator.validate(resolved.descriptor(), args.values());
        return new PreparedCall(this, resolved, args.values(), args.confirm(), ctx);
    }

    /**
     * Count and log a call refused before it ran. Used by the job manager
     * too, so batch and direct calls share one set of metrics.
     */
    public DispatchResult rejected(String name, Map<String, Object> arguments, OperationException e) {
        log.warn("Operation '{}' refused ({}): {}", name, e.getKind(), e.getMessage());
        // Unknown names come from callers; keep them out of metric tags.
        String tag = e.getKind() == OperationException.Kind.UNKNOWN_OPERATION ? "unknown" : name;
        count(tag, e.getKind().name().toLowerCase(Locale.ROOT));
        diagnostics.record(name, arguments, null, 0, e.getMessage());
        return DispatchResult.failure(e);
    }

    // ------------------------------------------------------------------
    // Invocation
    // ------------------------------------------------------------------

    DispatchResult invoke(PreparedCall call) {
        OperationDescriptor descriptor = call.descriptor();
        String name = descriptor.name();

        Timer.Sample sample = Timer.start(meterRegistry);
        long started = System.nanoTime();
        String outcome = "success";
        DispatchResult result;
        try {
            Outcome o = confirmation.invoke(descriptor, call.resolved().handler(),
                    call.arguments(), call.confirm(), call.context());
            if (o.requiresConfirmation()) {
                outcome = "confirmation_required";
                result = DispatchResult.confirmationRequired(o.preview());
            } else {
                result = DispatchResult.success(o.result());
            }
        } catch (OperationException e) {
            outcome = e.getKind().name().toLowerCase(Locale.ROOT);
            log.warn("Operation '{}' failed ({}): {}", name, e.getKind(), e.getMessage());
            result = DispatchResult.failure(e);
        } catch (Exception | Error e) {
            outcome = "handler_error";
            log.error("Operation '{}' ({}) raised an error: {}", name, call.context().invocationId(),
                    e.getMessage(), e);
            result = DispatchResult.failure(new OperationException(OperationException.Kind.HANDLER_ERROR,
                    "Operation '" + name + "' failed: " + describe(e), e));
        } finally {
            sample.stop(meterRegistry.timer("gateway.operation.duration",
                    "operation", name, "category", descriptor.category().key()));
        }
        count(name, outcome);

        if (diagnostics.enabled()) {
            long ms = (System.nanoTime() - started) / 1_000_000;
            diagnostics.record(name, call.arguments(), result.success() ? result.data() : result,
                    ms, result.error());
        }
        return result;
    }

    private void count(String operation, String outcome) {
        meterRegistry.counter("gateway.operation.calls", "operation", operation, "outcome", outcome).increment();
    }

    private static String describe(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
