package com.netpilot.gateway.registry;

/**
 * Whether a registered operation may be dispatched.
 *
 * UNRESOLVED  - lazy entry whose permission has not been evaluated yet;
 *               becomes CALLABLE or DENIED on its first execution attempt.
 * CALLABLE    - permission granted; dispatch allowed.
 * DENIED      - permission refused, or the lazy load failed. Still listed by
 *               discovery, never invocable.
 */
public enum RegistrationStatus {
    UNRESOLVED,
    CALLABLE,
    DENIED
}
