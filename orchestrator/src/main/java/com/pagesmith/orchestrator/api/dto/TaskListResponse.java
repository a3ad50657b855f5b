package com.pagesmith.orchestrator.api.dto;

import java.util.List;

/** Response body for GET /tasks. */
public record TaskListResponse(int total, List<TaskStatusResponse> tasks) {}
