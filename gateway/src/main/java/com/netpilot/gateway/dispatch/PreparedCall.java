package com.netpilot.gateway.dispatch;

import com.netpilot.gateway.operation.OperationContext;
import com.netpilot.gateway.operation.OperationDescriptor;
import com.netpilot.gateway.registry.ResolvedOperation;

import java.util.Map;

/**
 * A call that passed lookup, lazy load, permission check and argument
 * validation, and is ready to run.
 */
public final class PreparedCall {

    private final Dispatcher          dispatcher;
    private final ResolvedOperation   resolved;
    private final Map<String, Object> arguments;
    private final boolean             confirm;
    private final OperationContext    context;

    PreparedCall(Dispatcher dispatcher, ResolvedOperation resolved,
                 Map<String, Object> arguments, boolean confirm, OperationContext context) {
        this.dispatcher = dispatcher;
        this.resolved   = resolved;
        this.arguments  = arguments;
        this.confirm    = confirm;
        this.context    = context;
    }

    /** Run the call through the confirmation protocol. Never throws. */
    public DispatchResult invoke() {
        return dispatcher.invoke(this);
    }

    public OperationDescriptor descriptor()   { return resolved.descriptor(); }
    ResolvedOperation resolved()               { return resolved; }
    public Map<String, Object> arguments()    { return arguments; }
    public boolean confirm()                   { return confirm; }
    public OperationContext context()         { return context; }
}
