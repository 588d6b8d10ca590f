package com.netpilot.gateway.operation;

import java.util.Map;

/**
 * A named, schema-described unit of work the gateway can perform.
 *
 * Implementations are Spring beans declared {@code @Lazy}: in eager mode the
 * registry instantiates all of them at startup, in lazy mode a handler is only
 * created the first time its operation is dispatched.
 *
 * <p>Read operations implement this interface directly. Operations whose
 * {@linkplain OperationDescriptor#action() action} is mutating must implement
 * {@link MutatingOperation} so the confirmation protocol can preview them.
 */
public interface Operation {

    /** Identity, schema and permission metadata. */
    OperationDescriptor descriptor();

    /**
     * Perform the operation.
     *
     * @param arguments validated call arguments, without the reserved {@code confirm} flag
     * @return any JSON-serialisable value; becomes {@code data} in the dispatch result
     * @throws OperationException for failures the handler can describe
     * @throws Exception          anything else; wrapped as a handler error by the dispatcher
     */
    Object execute(Map<String, Object> arguments, OperationContext ctx) throws Exception;
}
