package com.pagesmith.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pagesmith.orchestrator.model.TaskError;
import com.pagesmith.orchestrator.model.TaskRecord;
import com.pagesmith.orchestrator.model.TaskState;

import java.time.Instant;
import java.util.List;

/**
 * Public view of a task record returned by GET /status/{nonce} and GET /tasks.
 * Leaves out the caller's email, attachments and the generated page.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskStatusResponse(
        String    nonce,
        String    task,
        int       round,
        TaskState state,
        @JsonProperty("repo_url")   String repoUrl,
        @JsonProperty("pages_url")  String pagesUrl,
        @JsonProperty("commit_sha") String commitSha,
        TaskError error,
        List<TaskError> warnings,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {
    public static TaskStatusResponse from(TaskRecord r) {
        return new TaskStatusResponse(
                r.getNonce(),
                r.getTaskName(),
                r.getRound(),
                r.getState(),
                r.getRepositoryUrl(),
                r.getPagesUrl(),
                r.getCommitSha(),
                r.getError(),
                r.getWarnings(),
                r.getCreatedAt(),
                r.getUpdatedAt()
        );
    }
}
