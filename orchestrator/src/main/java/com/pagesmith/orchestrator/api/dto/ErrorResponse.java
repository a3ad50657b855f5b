package com.pagesmith.orchestrator.api.dto;

import java.time.Instant;

/** Body of every 4xx answer: the error kind, what was wrong, and when. */
public record ErrorResponse(String error, String message, Instant timestamp) {}
