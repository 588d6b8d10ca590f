package com.netpilot.gateway.registry;

import com.netpilot.gateway.operation.Operation;

import java.util.List;

/** Supplies every known handler, instantiated, for eager registration. */
@FunctionalInterface
public interface HandlerSource {

    List<Operation> handlers();
}
