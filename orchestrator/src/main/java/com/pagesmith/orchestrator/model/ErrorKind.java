package com.pagesmith.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed taxonomy of everything that can go wrong in a task run.
 *
 * Only the fatal kinds ever end up in {@link TaskRecord#getError()}; the
 * non-fatal ones are recorded as warnings and the run carries on.
 */
public enum ErrorKind {
    VALIDATION_ERROR("ValidationError", true),
    GENERATION_RECOVERABLE("GenerationRecoverable", false),
    REPOSITORY_NAME_EXHAUSTED("RepositoryNameExhausted", true),
    REPOSITORY_UNAVAILABLE("RepositoryUnavailable", true),
    PUBLISH_DEGRADED("PublishDegraded", false),
    BUDGET_EXCEEDED("BudgetExceeded", true),
    NOTIFICATION_FAILED("NotificationFailed", false),
    INTERNAL("Internal", true);

    private final String wireName;
    private final boolean fatal;

    ErrorKind(String wireName, boolean fatal) {
        this.wireName = wireName;
        this.fatal    = fatal;
    }

    @JsonValue
    public String wireName() { return wireName; }

    public boolean isFatal()  { return fatal; }
}
