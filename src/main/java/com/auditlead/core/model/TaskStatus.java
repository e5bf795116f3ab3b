package com.auditlead.core.model;

import java.util.Locale;

/**
 * Status of a single agent within one audit run.
 * <p>
 * The only legal path is PENDING -> RUNNING -> (COMPLETED | FAILED).
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING;
            case RUNNING -> next == RUNNING || next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    /** Lower-case name used in persisted rows and event payloads. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
