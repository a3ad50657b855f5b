package com.pagesmith.orchestrator.model;

import java.util.List;

/**
 * Outcome of committing the project files.
 *
 * @param commitSha  SHA the default branch points at afterwards
 * @param files      paths written in the commit
 * @param unchanged  true when the branch already held identical content and no
 *                   new commit was created
 */
public record CommitResult(String commitSha, List<String> files, boolean unchanged) {}
