package com.pagesmith.orchestrator.hosting.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * GET /repos/{owner}/{repo}/git/ref/heads/{branch}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RefResponse(String ref, Target object) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Target(String sha, String type) {}
}
