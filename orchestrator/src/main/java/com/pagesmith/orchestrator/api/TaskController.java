package com.pagesmith.orchestrator.api;

import com.pagesmith.orchestrator.api.dto.SubmitTaskRequest;
import com.pagesmith.orchestrator.api.dto.TaskAcceptedResponse;
import com.pagesmith.orchestrator.api.dto.TaskListResponse;
import com.pagesmith.orchestrator.api.dto.TaskStatusResponse;
import com.pagesmith.orchestrator.config.PagesmithProperties;
import com.pagesmith.orchestrator.model.TaskRecord;
import com.pagesmith.orchestrator.repository.DuplicateNonceException;
import com.pagesmith.orchestrator.service.TaskOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * HTTP front door.
 *
 * POST /task             authenticate, validate and accept a task; returns at once
 * GET  /status/{nonce}   current state of one submission
 * GET  /tasks            every submission this process has seen
 */
@RestController
public class TaskController {

    private final TaskOrchestrator    orchestrator;
    private final PagesmithProperties properties;

    public TaskController(TaskOrchestrator orchestrator, PagesmithProperties properties) {
        this.orchestrator = orchestrator;
        this.properties   = properties;
    }

    /**
     * Accept a task.
     *
     * Example:
     *   curl -X POST http://localhost:8080/task \
     *     -H "Content-Type: application/json" \
     *     -d '{"task":"demo","round":1,"nonce":"n-1","brief":"page with h1#title",
     *          "evaluation_url":"https://example.com/notify","secret":"..."}'
     */
    @PostMapping("/task")
    public TaskAcceptedResponse submit(@RequestBody SubmitTaskRequest req) {
        if (!secretMatches(req.secret())) {
            throw TaskRejectedException.unauthorized();
        }
        try {
            TaskRecord record = orchestrator.submit(TaskRequestMapper.toSubmission(req));
            return TaskAcceptedResponse.accepted(record);
        } catch (DuplicateNonceException e) {
            TaskRecord existing = orchestrator.findByNonce(e.getNonce()).orElseThrow(() -> e);
            return TaskAcceptedResponse.duplicate(existing);
        }
    }

    /** Returns 404 if the nonce was never accepted. */
    @GetMapping("/status/{nonce}")
    public TaskStatusResponse status(@PathVariable String nonce) {
        return orchestrator.findByNonce(nonce)
                .map(TaskStatusResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Task not found: " + nonce));
    }

    @GetMapping("/tasks")
    public TaskListResponse list() {
        List<TaskStatusResponse> tasks = orchestrator.findAll().stream()
                .map(TaskStatusResponse::from)
                .toList();
        return new TaskListResponse(tasks.size(), tasks);
    }

    private boolean secretMatches(String supplied) {
        if (!properties.hasSecret() || supplied == null) {
            return false;
        }
        return MessageDigest.isEqual(
                properties.getSecret().getBytes(StandardCharsets.UTF_8),
                supplied.getBytes(StandardCharsets.UTF_8));
    }
}
