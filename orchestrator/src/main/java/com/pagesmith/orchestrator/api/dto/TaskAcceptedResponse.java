package com.pagesmith.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.pagesmith.orchestrator.model.TaskRecord;
import com.pagesmith.orchestrator.model.TaskState;

import java.time.Instant;

/**
 * Response body for POST /task: "accepted" for a new nonce, "duplicate" (with
 * the current state) when the nonce is already known.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskAcceptedResponse(
        String    status,
        String    message,
        String    nonce,
        TaskState state,
        Instant   timestamp
) {
    public static TaskAcceptedResponse accepted(TaskRecord record) {
        return new TaskAcceptedResponse("accepted",
                "Task '%s' round %d accepted for processing".formatted(record.getTaskName(), record.getRound()),
                record.getNonce(), null, Instant.now());
    }

    public static TaskAcceptedResponse duplicate(TaskRecord record) {
        return new TaskAcceptedResponse("duplicate",
                "Nonce already accepted; no new run started",
                record.getNonce(), record.getState(), Instant.now());
    }
}
