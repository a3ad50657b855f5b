package com.pagesmith.orchestrator.hosting.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Git tree object (GET/POST /repos/{owner}/{repo}/git/trees).
 * Only "blob" entries are files; "tree" entries are directories.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TreeResponse(String sha, List<Entry> tree, boolean truncated) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(String path, String mode, String type, String sha) {}
}
