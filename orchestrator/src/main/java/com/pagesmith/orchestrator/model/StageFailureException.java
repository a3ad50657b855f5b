package com.pagesmith.orchestrator.model;

/**
 * Thrown by a stage when it has no compensating action left.
 *
 * The orchestrator catches it, moves the record to FAILED with the carried
 * {@link TaskError}, and sends the failure callback.
 */
public class StageFailureException extends RuntimeException {

    private final TaskError error;

    public StageFailureException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public StageFailureException(ErrorKind kind, String message, Throwable cause) {
        super("[" + kind.wireName() + "] " + message, cause);
        this.error = TaskError.of(kind, message);
    }

    public TaskError getError() { return error; }

    public ErrorKind getKind()  { return error.kind(); }
}
