package com.pagesmith.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * States of one task run.
 *
 * Transitions (happy path):
 *   QUEUED → GENERATING → COMMITTING → PUBLISHING → NOTIFYING → COMPLETED
 *
 * A publish failure still moves PUBLISHING → NOTIFYING (degrade, keep reporting).
 * Every non-terminal state can move to FAILED on a fatal stage error or when the
 * wall-clock budget runs out. COMPLETED and FAILED are terminal.
 */
public enum TaskState {
    QUEUED,
    GENERATING,
    COMMITTING,
    PUBLISHING,
    NOTIFYING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(TaskState next) {
        return successors().contains(next);
    }

    private Set<TaskState> successors() {
        return switch (this) {
            case QUEUED     -> EnumSet.of(GENERATING, FAILED);
            case GENERATING -> EnumSet.of(COMMITTING, FAILED);
            case COMMITTING -> EnumSet.of(PUBLISHING, FAILED);
            case PUBLISHING -> EnumSet.of(NOTIFYING, FAILED);
            case NOTIFYING  -> EnumSet.of(COMPLETED, FAILED);
            case COMPLETED, FAILED -> EnumSet.noneOf(TaskState.class);
        };
    }

    /** Lower-case name used on the wire ("queued", "completed", ...). */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
