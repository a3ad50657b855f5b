package com.pagesmith.orchestrator.hosting.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Git commit object (GET/POST /repos/{owner}/{repo}/git/commits).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitCommitResponse(String sha, TreeRef tree) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TreeRef(String sha) {}
}
