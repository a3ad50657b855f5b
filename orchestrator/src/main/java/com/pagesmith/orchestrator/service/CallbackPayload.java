package com.pagesmith.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pagesmith.orchestrator.model.TaskError;
import com.pagesmith.orchestrator.model.TaskRecord;

import java.time.Instant;

/**
 * Body POSTed to the caller's evaluation URL when a run finishes.
 * Unknown values (e.g. no pages URL after a failed commit) are left out.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CallbackPayload(
        String email,
        String task,
        int    round,
        String nonce,
        String status,
        @JsonProperty("repo_url")   String repoUrl,
        @JsonProperty("commit_sha") String commitSha,
        @JsonProperty("pages_url")  String pagesUrl,
        ErrorBody error,
        String timestamp
) {
    public record ErrorBody(String kind, String message) {
        static ErrorBody of(TaskError error) {
            return error == null ? null : new ErrorBody(error.kind().wireName(), error.message());
        }
    }

    /** Snapshot of {@code record} reporting {@code status} ("completed" or "failed"). */
    public static CallbackPayload from(TaskRecord record, String status) {
        return new CallbackPayload(
                record.getEmail(),
                record.getTaskName(),
                record.getRound(),
                record.getNonce(),
                status,
                record.getRepositoryUrl(),
                record.getCommitSha(),
                record.getPagesUrl(),
                ErrorBody.of(record.getError()),
                Instant.now().toString()
        );
    }
}
