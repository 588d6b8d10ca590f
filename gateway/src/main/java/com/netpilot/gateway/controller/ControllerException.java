package com.netpilot.gateway.controller;

/**
 * Thrown when the network controller returns an error or is unreachable.
 */
public class ControllerException extends RuntimeException {

    public ControllerException(String message) {
        super(message);
    }

    public ControllerException(String message, Throwable cause) {
        super(message, cause);
    }
}
