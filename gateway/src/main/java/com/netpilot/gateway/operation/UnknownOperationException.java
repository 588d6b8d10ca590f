package com.netpilot.gateway.operation;

public class UnknownOperationException extends OperationException {
    public UnknownOperationException(String name) {
        super(Kind.UNKNOWN_OPERATION, "No operation registered with name: '" + name + "'");
    }
}
