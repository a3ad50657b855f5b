package com.pagesmith.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagesmith.orchestrator.config.PagesmithProperties;
import com.pagesmith.orchestrator.model.ErrorKind;
import com.pagesmith.orchestrator.model.StageFailureException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Delivers the final result of a run to the caller-supplied evaluation URL.
 *
 * Transport failures and non-2xx replies are retried under the callback
 * {@link RetryPolicy}. When every attempt fails the notifier raises a
 * {@code NotificationFailed} stage failure, which the orchestrator records as a
 * warning without touching the run's outcome.
 */
@Service
public class CallbackNotifier {

    private static final Logger log = LoggerFactory.getLogger(CallbackNotifier.class);

    private final HttpClient    http;
    private final ObjectMapper  json;
    private final RetryPolicy   retry;
    private final Duration      timeout;
    private final MeterRegistry meters;

    @Autowired
    public CallbackNotifier(PagesmithProperties properties, ObjectMapper objectMapper, MeterRegistry meters) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
             objectMapper,
             properties.getCallback().getRetry().toPolicy(),
             properties.getCallback().getTimeout(),
             meters);
    }

    CallbackNotifier(HttpClient http, ObjectMapper objectMapper, RetryPolicy retry,
                     Duration timeout, MeterRegistry meters) {
        this.http    = http;
        this.json    = objectMapper;
        this.retry   = retry;
        this.timeout = timeout;
        this.meters  = meters;
    }

    /**
     * POST {@code payload} to {@code evaluationUrl}.
     *
     * @throws StageFailureException {@code NotificationFailed} when delivery is given up
     * @throws InterruptedException  if the run is abandoned while waiting
     */
    public void notify(String evaluationUrl, CallbackPayload payload) throws InterruptedException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(evaluationUrl))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(payload)))
                    .build();
        } catch (IllegalArgumentException | NullPointerException | JsonProcessingException e) {
            throw new StageFailureException(ErrorKind.NOTIFICATION_FAILED,
                    "Cannot build callback to '" + evaluationUrl + "': " + e.getMessage(), e);
        }

        try {
            int status = retry.execute("callback " + evaluationUrl, () -> deliver(request), e -> true);
            log.info("Callback delivered to {} (HTTP {}, status={})", evaluationUrl, status, payload.status());
        } catch (CallbackDeliveryException | UncheckedIOException e) {
            throw new StageFailureException(ErrorKind.NOTIFICATION_FAILED,
                    "Callback to " + evaluationUrl + " failed after " + retry.maxAttempts()
                            + " attempts: " + e.getMessage(), e);
        }
    }

    private int deliver(HttpRequest request) throws InterruptedException {
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            meters.counter("pagesmith.callback.attempts", "outcome", "unreachable").increment();
            throw new UncheckedIOException(e);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            meters.counter("pagesmith.callback.attempts", "outcome", "rejected").increment();
            throw new CallbackDeliveryException(status, response.body());
        }
        meters.counter("pagesmith.callback.attempts", "outcome", "delivered").increment();
        return status;
    }

    /** The callback endpoint answered with a non-2xx status. */
    static class CallbackDeliveryException extends RuntimeException {

        private final int statusCode;

        CallbackDeliveryException(int statusCode, String body) {
            super("HTTP " + statusCode + ": " + body);
            this.statusCode = statusCode;
        }

        int statusCode() { return statusCode; }
    }
}
