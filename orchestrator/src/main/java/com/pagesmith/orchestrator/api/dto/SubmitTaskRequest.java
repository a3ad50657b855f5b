package com.pagesmith.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Request body for POST /task.
 *
 * Required: task, nonce, brief, evaluation_url, secret.
 * round defaults to 1. attachments are data URLs; checks may be strings or
 * objects (an object's {@code js} field is used when present).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubmitTaskRequest(
        String email,
        String task,
        Integer round,
        String nonce,
        String brief,
        List<Attachment> attachments,
        List<JsonNode> checks,
        @JsonProperty("evaluation_url") String evaluationUrl,
        String endpoint,
        String secret
) {
    public SubmitTaskRequest {
        if (round == null) round = 1;
        if (attachments == null) attachments = List.of();
        if (checks == null) checks = List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Attachment(String name, String url) {}
}
