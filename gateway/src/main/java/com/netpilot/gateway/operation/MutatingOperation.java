package com.netpilot.gateway.operation;

import com.netpilot.gateway.confirmation.Preview;

import java.util.Map;

/**
 * An operation that changes controller state and therefore has a preview path.
 *
 * <p>{@link #preview} is called for every unconfirmed call and must not
 * mutate anything: it reads current state and describes the proposed change.
 * The confirmation protocol trusts this contract; it cannot enforce it.
 */
public interface MutatingOperation extends Operation {

    Preview preview(Map<String, Object> arguments, OperationContext ctx) throws Exception;
}
