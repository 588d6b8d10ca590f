package com.netpilot.gateway.registry;

import com.netpilot.gateway.operation.Operation;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Eager handler source: instantiates every {@link Operation} bean.
 *
 * Handlers are declared {@code @Lazy}, so nothing is created until this
 * source is asked.
 */
@Component
public class SpringHandlerSource implements HandlerSource {

    private final ObjectProvider<Operation> operations;

    public SpringHandlerSource(ObjectProvider<Operation> operations) {
        this.operations = operations;
    }

    @Override
    public List<Operation> handlers() {
        return operations.orderedStream().toList();
    }
}
