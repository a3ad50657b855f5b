package com.pagesmith.orchestrator.llm;

/**
 * The generative provider failed to produce a completion.
 */
public class LlmApiException extends RuntimeException {

    public static final int NO_RESPONSE    = -1;
    public static final int NOT_CONFIGURED = -2;

    private final int statusCode;

    public LlmApiException(int statusCode, String body) {
        this(statusCode, body, null);
    }

    public LlmApiException(int statusCode, String body, Throwable cause) {
        super("LLM API error %d: %s".formatted(statusCode, body), cause);
        this.statusCode = statusCode;
    }

    public int statusCode() { return statusCode; }
}
