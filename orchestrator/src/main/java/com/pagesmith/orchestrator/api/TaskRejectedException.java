package com.pagesmith.orchestrator.api;

import org.springframework.http.HttpStatus;

/**
 * A submission refused before any record is created.
 * Mapped to an {@link com.pagesmith.orchestrator.api.dto.ErrorResponse} by {@link ApiExceptionHandler}.
 */
public class TaskRejectedException extends RuntimeException {

    private final HttpStatus status;
    private final String     kind;

    public TaskRejectedException(HttpStatus status, String kind, String message) {
        super(message);
        this.status = status;
        this.kind   = kind;
    }

    public static TaskRejectedException invalid(String message) {
        return new TaskRejectedException(HttpStatus.BAD_REQUEST, "ValidationError", message);
    }

    public static TaskRejectedException unauthorized() {
        return new TaskRejectedException(HttpStatus.UNAUTHORIZED, "Unauthorized", "Invalid secret");
    }

    public HttpStatus status() { return status; }

    public String kind()       { return kind; }
}
