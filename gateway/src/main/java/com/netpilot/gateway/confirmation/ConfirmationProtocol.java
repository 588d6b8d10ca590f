package com.netpilot.gateway.confirmation;

import com.netpilot.gateway.operation.MutatingOperation;
import com.netpilot.gateway.operation.Operation;
import com.netpilot.gateway.operation.OperationContext;
import com.netpilot.gateway.operation.OperationDescriptor;
import com.netpilot.gateway.operation.OperationException;
import com.netpilot.gateway.permission.Flags;
import com.netpilot.gateway.permission.PermissionOverrideSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Preview-then-commit gate for mutating operations.
 *
 * <ul>
 *   <li>read operation: executed directly;</li>
 *   <li>mutating, {@code confirm} false: only {@link MutatingOperation#preview}
 *       runs and the outcome carries the preview; {@code execute} is never called;</li>
 *   <li>mutating, {@code confirm} true: {@code execute} runs, no preview.</li>
 * </ul>
 *
 * When auto-confirm is on, every call takes the confirmed path regardless of
 * the caller's flag. That switch removes the only human checkpoint before a
 * state change and should stay off for interactive callers.
 *
 * <p>That a preview has no side effects is a contract on each handler, not
 * something this class can check.
 */
@Component
public class ConfirmationProtocol {

    private static final Logger log = LoggerFactory.getLogger(ConfirmationProtocol.class);

    /** Reserved argument name carrying the caller's confirmation. */
    public static final String CONFIRM_ARGUMENT = "confirm";

    private final boolean autoConfirm;

    public ConfirmationProtocol(ConfirmationProperties properties, PermissionOverrideSource overrides) {
        this.autoConfirm = overrides.lookup(properties.overrideKey())
                .map(Flags::isTruthy)
                .orElse(properties.autoConfirm());
        if (autoConfirm) {
            log.warn("Auto-confirm is ON: mutating operations execute without a preview step");
        }
    }

    public boolean isAutoConfirm() {
        return autoConfirm;
    }

    /**
     * Run {@code handler} through the protocol.
     *
     * @param arguments call arguments with {@code confirm} already removed
     * @param confirm   the caller's confirmation flag
     */
    public Outcome invoke(OperationDescriptor descriptor,
                          Operation handler,
                          Map<String, Object> arguments,
                          boolean confirm,
                          OperationContext ctx) throws Exception {
        if (!descriptor.isMutating()) {
            return Outcome.executed(handler.execute(arguments, ctx));
        }
        if (confirm || autoConfirm) {
            log.info("Executing mutating operation '{}' ({}){}", descriptor.name(), ctx.invocationId(),
                    confirm ? "" : " via auto-confirm");
            return Outcome.executed(handler.execute(arguments, ctx));
        }
        if (!(handler instanceof MutatingOperation mutating)) {
            throw new IllegalStateException("Mutating operation '" + descriptor.name()
                    + "' has no preview path");
        }
        log.debug("Previewing '{}' ({}), confirmation required", descriptor.name(), ctx.invocationId());
        Preview preview = mutating.preview(arguments, ctx);
        if (preview == null) {
            throw new OperationException(OperationException.Kind.HANDLER_ERROR,
                    "Operation '" + descriptor.name() + "' returned no preview");
        }
        return Outcome.previewed(preview);
    }

    /** Split the reserved {@code confirm} flag off the caller's arguments. */
    public static CallArguments split(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return new CallArguments(Map.of(), false);
        }
        Map<String, Object> values = new LinkedHashMap<>(raw);
        boolean confirm = Flags.isTruthy(values.remove(CONFIRM_ARGUMENT), false);
        return new CallArguments(Collections.unmodifiableMap(values), confirm);
    }

    /** Caller arguments with the confirm flag separated out. */
    public record CallArguments(Map<String, Object> values, boolean confirm) {}

    /**
     * Either the handler's result or a preview awaiting confirmation.
     */
    public record Outcome(Object result, Preview preview, boolean requiresConfirmation) {

        static Outcome executed(Object result) {
            return new Outcome(result, null, false);
        }

        static Outcome previewed(Preview preview) {
            return new Outcome(null, preview, true);
        }
    }
}
