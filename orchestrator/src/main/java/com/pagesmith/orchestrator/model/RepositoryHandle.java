package com.pagesmith.orchestrator.model;

/**
 * Identifies one repository on the hosting provider.
 *
 * @param owner         account that owns the repository
 * @param name          repository name (after collision resolution)
 * @param htmlUrl       browsable URL of the repository
 * @param defaultBranch branch commits land on and pages are served from
 */
public record RepositoryHandle(String owner, String name, String htmlUrl, String defaultBranch) {

    public String fullName() {
        return owner + "/" + name;
    }
}
