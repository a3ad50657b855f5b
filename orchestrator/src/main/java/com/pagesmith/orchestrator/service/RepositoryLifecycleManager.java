package com.pagesmith.orchestrator.service;

import com.pagesmith.orchestrator.config.PagesmithProperties;
import com.pagesmith.orchestrator.hosting.BranchSnapshot;
import com.pagesmith.orchestrator.hosting.GitBlobs;
import com.pagesmith.orchestrator.hosting.HostingException;
import com.pagesmith.orchestrator.hosting.HostingProvider;
import com.pagesmith.orchestrator.hosting.NameCollisionException;
import com.pagesmith.orchestrator.model.CommitResult;
import com.pagesmith.orchestrator.model.ErrorKind;
import com.pagesmith.orchestrator.model.RepositoryHandle;
import com.pagesmith.orchestrator.model.StageFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the hosting-side resources of each task: one repository per requester and
 * task name, and the commits made to it.
 *
 * <h3>Repository resolution</h3>
 * The repository name is {@code prefix-task-requester}, where the requester is the
 * local part of the submitter's email. The (requester, task) pair is bound to a
 * repository handle the first time a round resolves one, and every later round
 * reuses the binding without talking to the provider. Without a binding (e.g. after
 * a restart), round 1 creates a repository and rounds ≥ 2 look up the derived name
 * first, only creating as a last resort.
 *
 * Every candidate name is looked up before it is created. One that already exists
 * counts as a collision and resolution moves on to {@code name-2}, {@code name-3}, ...
 * An existing repository is only adopted when the lookup saw the name free and our
 * own create call may have landed before its response was lost.
 *
 * <h3>Commits</h3>
 * Every attempt first re-reads the default branch. If it already holds exactly
 * the files we are about to write (a previous attempt landed but its response
 * was lost), the existing head is returned and no second commit is made.
 *
 * Resolution is serialized per derived name, commits per repository; different
 * tasks never wait on each other.
 */
@Service
public class RepositoryLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(RepositoryLifecycleManager.class);

    static final int MAX_NAME_LENGTH = 100;

    private final HostingProvider hosting;
    private final RetryPolicy     retry;
    private final String          repoPrefix;
    private final int             maxNameAttempts;

    // "requester/taskName" -> repository resolved by an earlier round
    private final Map<String, RepositoryHandle> bindings = new ConcurrentHashMap<>();
    // "name:<derived name>" for resolution, "repo:<owner/name>" for commits
    private final Map<String, ReentrantLock>    locks    = new ConcurrentHashMap<>();

    @Autowired
    public RepositoryLifecycleManager(HostingProvider hosting, PagesmithProperties properties) {
        this(hosting,
             properties.getGithub().getRetry().toPolicy(),
             properties.getGithub().getRepoPrefix(),
             properties.getGithub().getMaxNameAttempts());
    }

    RepositoryLifecycleManager(HostingProvider hosting, RetryPolicy retry,
                               String repoPrefix, int maxNameAttempts) {
        this.hosting         = hosting;
        this.retry           = retry;
        this.repoPrefix      = repoPrefix;
        this.maxNameAttempts = maxNameAttempts;
    }

    // ------------------------------------------------------------------
    // Repository resolution
    // ------------------------------------------------------------------

    /**
     * Repository for {@code taskName} submitted by {@code email}, creating it if no
     * round has resolved one yet.
     *
     * @throws StageFailureException {@code RepositoryNameExhausted} when every candidate
     *         name is taken, {@code RepositoryUnavailable} when the provider keeps failing
     */
    public RepositoryHandle ensureRepository(String email, String taskName, int round) throws InterruptedException {
        String requester = requester(email);
        String key  = requester + "/" + taskName;
        String name = repositoryName(repoPrefix, taskName, requester);

        // Task names that sanitize to the same repository name share one lock.
        ReentrantLock lock = locks.computeIfAbsent("name:" + name, k -> new ReentrantLock());
        lock.lockInterruptibly();
        try {
            RepositoryHandle bound = bindings.get(key);
            if (bound != null) {
                log.info("Reusing repository {} for task '{}' (round {})", bound.fullName(), taskName, round);
                return bound;
            }

            if (round >= 2) {
                Optional<RepositoryHandle> existing =
                        withRetry("findRepository " + name, () -> hosting.findRepository(name));
                if (existing.isPresent()) {
                    log.info("Found round-1 repository {} for task '{}'", existing.get().fullName(), taskName);
                    bindings.put(key, existing.get());
                    return existing.get();
                }
                log.warn("Round {} of task '{}' has no earlier repository, creating one", round, taskName);
            }

            RepositoryHandle created = create(taskName, name);
            bindings.put(key, created);
            return created;
        } finally {
            lock.unlock();
        }
    }

    /** Repository already bound to this requester's {@code taskName}, if any round resolved one. */
    public Optional<RepositoryHandle> boundRepository(String email, String taskName) {
        return Optional.ofNullable(bindings.get(requester(email) + "/" + taskName));
    }

    private RepositoryHandle create(String taskName, String baseName) throws InterruptedException {
        String description = "Generated page for task " + taskName;
        for (int attempt = 1; attempt <= maxNameAttempts; attempt++) {
            String candidate = candidateName(baseName, attempt);
            if (withRetry("findRepository " + candidate, () -> hosting.findRepository(candidate)).isPresent()) {
                log.info("Repository name '{}' already exists (attempt {}/{})", candidate, attempt, maxNameAttempts);
                continue;
            }
            // Set when a create failed without a definite answer: it may have landed.
            boolean[] uncertain = {false};
            try {
                return retry.execute("createRepository " + candidate,
                        () -> hosting.createRepository(candidate, description),
                        e -> {
                            boolean again = isTransient(e);
                            uncertain[0] |= again;
                            return again;
                        });
            } catch (NameCollisionException e) {
                if (uncertain[0]) {
                    Optional<RepositoryHandle> ours =
                            withRetry("findRepository " + candidate, () -> hosting.findRepository(candidate));
                    if (ours.isPresent()) {
                        log.info("Repository {} was created by an earlier attempt", ours.get().fullName());
                        return ours.get();
                    }
                }
                log.info("Repository name '{}' is taken (attempt {}/{})", candidate, attempt, maxNameAttempts);
            } catch (HostingException e) {
                throw unavailable("createRepository " + candidate, e);
            }
        }
        throw new StageFailureException(ErrorKind.REPOSITORY_NAME_EXHAUSTED,
                "No free repository name for '%s' after %d attempts".formatted(baseName, maxNameAttempts));
    }

    /** Local part of {@code email}; empty when there is none. */
    static String requester(String email) {
        if (email == null || email.isBlank()) {
            return "";
        }
        int at = email.indexOf('@');
        return (at < 0 ? email : email.substring(0, at)).strip();
    }

    /**
     * {@code prefix-taskName-requester}, lower-cased, with everything outside
     * {@code [a-z0-9-]} turned into single dashes and trimmed to the provider's
     * length limit. A blank prefix or requester is left out.
     */
    public static String repositoryName(String prefix, String taskName, String requester) {
        StringBuilder raw = new StringBuilder();
        if (prefix != null && !prefix.isBlank()) {
            raw.append(prefix).append('-');
        }
        raw.append(taskName == null ? "" : taskName);
        if (requester != null && !requester.isBlank()) {
            raw.append('-').append(requester);
        }
        String name = raw.toString().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9-]", "-")
                .replaceAll("-{2,}", "-")
                .replaceAll("^-+|-+$", "");
        if (name.length() > MAX_NAME_LENGTH) {
            name = name.substring(0, MAX_NAME_LENGTH).replaceAll("-+$", "");
        }
        return name.isEmpty() ? "task" : name;
    }

    /** {@code base}, then {@code base-2}, {@code base-3}, ... kept within the length limit. */
    static String candidateName(String base, int attempt) {
        if (attempt == 1) {
            return base;
        }
        String suffix = "-" + attempt;
        String stem = base.length() + suffix.length() > MAX_NAME_LENGTH
                ? base.substring(0, MAX_NAME_LENGTH - suffix.length())
                : base;
        return stem + suffix;
    }

    // ------------------------------------------------------------------
    // Commits
    // ------------------------------------------------------------------

    /**
     * Write {@code files} to the default branch of {@code repo} as one commit.
     *
     * @throws StageFailureException {@code RepositoryUnavailable} once retries are exhausted;
     *         the branch is then left exactly as it was before the call
     */
    public CommitResult commitFiles(RepositoryHandle repo, Map<String, String> files, String message)
            throws InterruptedException {
        ReentrantLock lock = locks.computeIfAbsent("repo:" + repo.fullName(), k -> new ReentrantLock());
        lock.lockInterruptibly();
        try {
            List<String> paths = List.copyOf(files.keySet());
            CommitResult result = withRetry("commit " + repo.fullName(), () -> {
                Optional<BranchSnapshot> head = hosting.readDefaultBranch(repo);
                if (head.isPresent() && containsAll(head.get(), files)) {
                    return new CommitResult(head.get().commitSha(), paths, true);
                }
                return new CommitResult(hosting.commitFiles(repo, files, message), paths, false);
            });
            if (result.unchanged()) {
                log.info("{} already holds these {} files at {}, nothing to commit",
                        repo.fullName(), files.size(), result.commitSha());
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    private static boolean containsAll(BranchSnapshot head, Map<String, String> files) {
        for (Map.Entry<String, String> file : files.entrySet()) {
            if (!GitBlobs.sha(file.getValue()).equals(head.blobShas().get(file.getKey()))) {
                return false;
            }
        }
        return true;
    }

    // ------------------------------------------------------------------
    // Retry plumbing
    // ------------------------------------------------------------------

    private <T> T withRetry(String operation, RetryPolicy.Attempt<T> call) throws InterruptedException {
        try {
            return retry.execute(operation, call, RepositoryLifecycleManager::isTransient);
        } catch (HostingException e) {
            throw unavailable(operation, e);
        }
    }

    private static boolean isTransient(RuntimeException e) {
        return e instanceof HostingException h && h.isTransient();
    }

    private StageFailureException unavailable(String operation, HostingException e) throws InterruptedException {
        // The provider client reports an interrupted call as a HostingException.
        if (Thread.interrupted()) {
            throw new InterruptedException(operation + " abandoned");
        }
        return new StageFailureException(ErrorKind.REPOSITORY_UNAVAILABLE,
                operation + " failed: " + e.getMessage(), e);
    }
}
