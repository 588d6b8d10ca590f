package com.netpilot.gateway.operation;

/**
 * Controlled failure of a lookup, permission check, validation, lazy load or
 * handler call.
 *
 * Unchecked; the dispatcher and the job manager convert it into a structured
 * {@code {success:false, error}} result, so it never reaches the caller as a
 * raw exception.
 */
public class OperationException extends RuntimeException {

    public enum Kind { UNKNOWN_OPERATION, PERMISSION_DENIED, VALIDATION_ERROR, LOAD_ERROR, HANDLER_ERROR }

    private final Kind kind;

    public OperationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public OperationException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
