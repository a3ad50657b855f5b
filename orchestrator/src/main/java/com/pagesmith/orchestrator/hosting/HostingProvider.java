package com.pagesmith.orchestrator.hosting;

import com.pagesmith.orchestrator.model.RepositoryHandle;

import java.util.Map;
import java.util.Optional;

/**
 * Source-hosting operations the orchestrator relies on.
 *
 * Every method may throw {@link HostingException}. All calls except
 * {@link #createRepository} are idempotent.
 */
public interface HostingProvider {

    /** Whether credentials are present; calls fail fast otherwise. */
    boolean isConfigured();

    /**
     * Create a public repository whose default branch already exists.
     *
     * @throws NameCollisionException if the name is taken
     */
    RepositoryHandle createRepository(String name, String description);

    /** Look up a repository of the configured owner by name. */
    Optional<RepositoryHandle> findRepository(String name);

    /** Head commit and file list of the default branch, empty if it has no commits. */
    Optional<BranchSnapshot> readDefaultBranch(RepositoryHandle repo);

    /**
     * Write all {@code files} (path → UTF-8 content) as one commit on the default
     * branch. The branch moves in a single ref update at the very end, so either
     * every file becomes visible or none does.
     *
     * @return SHA of the new commit
     */
    String commitFiles(RepositoryHandle repo, Map<String, String> files, String message);

    /** Turn on static hosting from the root of the default branch; no-op if already on. */
    void enablePages(RepositoryHandle repo);

    /** Public URL of the hosted site, if the provider reports one. */
    Optional<String> findPagesUrl(RepositoryHandle repo);
}
