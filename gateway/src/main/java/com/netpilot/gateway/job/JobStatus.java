package com.netpilot.gateway.job;

import java.util.Locale;

/**
 * Lifecycle of a batch job.
 *
 * Transitions:
 *   PENDING → RUNNING → DONE | ERROR
 *   PENDING → ERROR   (refused before running: unknown, denied, invalid)
 *
 * DONE and ERROR are terminal.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    DONE,
    ERROR;

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }

    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == ERROR;
            case RUNNING -> next == DONE || next == ERROR;
            case DONE, ERROR -> false;
        };
    }

    /** Wire form: {@code pending}, {@code running}, {@code done}, {@code error}. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
