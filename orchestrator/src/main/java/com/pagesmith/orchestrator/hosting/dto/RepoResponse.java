package com.pagesmith.orchestrator.hosting.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Subset of GitHub's repository object (POST /user/repos, GET /repos/{owner}/{repo}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RepoResponse(
        String name,
        String full_name,
        String html_url,
        String default_branch,
        Owner  owner
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Owner(String login) {}
}
