package com.pagesmith.orchestrator.hosting;

/**
 * Thrown when the hosting provider returns an error or cannot be reached.
 *
 * {@link #isTransient()} tells the retry policy whether another attempt can
 * help: rate limiting, 5xx responses and network failures can; auth errors,
 * validation errors and missing resources cannot.
 */
public class HostingException extends RuntimeException {

    /** Status used when no HTTP response was received at all. */
    public static final int NO_RESPONSE = -1;

    private final int statusCode;
    private final boolean transientFailure;

    public HostingException(String message, int statusCode, boolean transientFailure) {
        this(message, statusCode, transientFailure, null);
    }

    public HostingException(String message, int statusCode, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.statusCode       = statusCode;
        this.transientFailure = transientFailure;
    }

    /** Network-level failure: no response, always worth retrying. */
    public static HostingException unreachable(String operation, Throwable cause) {
        return new HostingException(operation + " failed: " + cause.getMessage(), NO_RESPONSE, true, cause);
    }

    public int statusCode()      { return statusCode; }

    public boolean isTransient() { return transientFailure; }
}
