package com.netpilot.gateway.registry;

import com.netpilot.gateway.operation.Operation;
import com.netpilot.gateway.operation.OperationDescriptor;

/** A callable operation with its resident handler, ready to invoke. */
public record ResolvedOperation(OperationDescriptor descriptor, Operation handler) {}
