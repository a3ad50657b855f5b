package com.pagesmith.orchestrator.model;

import java.time.Instant;

/**
 * Structured cause attached to a task record: what kind of failure, a
 * human-readable message, and when it happened.
 */
public record TaskError(ErrorKind kind, String message, Instant occurredAt) {

    public static TaskError of(ErrorKind kind, String message) {
        return new TaskError(kind, message, Instant.now());
    }
}
