package com.pagesmith.orchestrator.hosting;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagesmith.orchestrator.config.PagesmithProperties;
import com.pagesmith.orchestrator.hosting.dto.*;
import com.pagesmith.orchestrator.model.RepositoryHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@link HostingProvider} backed by the GitHub REST API.
 *
 * Commits go through the Git Data API (blobs → tree → commit → ref) rather than
 * the per-file contents API: nothing is reachable from the branch until the
 * final ref update, which is what makes a multi-file commit atomic.
 *
 * Uses java.net.http.HttpClient directly; every call blocks the worker thread
 * that runs the task, and is interruptible when the task is abandoned.
 */
@Component
public class GitHubHostingProvider implements HostingProvider {

    private static final Logger log = LoggerFactory.getLogger(GitHubHostingProvider.class);

    private static final String API_VERSION = "2022-11-28";
    private static final String ACCEPT      = "application/vnd.github+json";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final PagesmithProperties.Github config;

    @Autowired
    public GitHubHostingProvider(PagesmithProperties properties, ObjectMapper objectMapper) {
        this(properties.getGithub(), objectMapper, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    GitHubHostingProvider(PagesmithProperties.Github config, ObjectMapper objectMapper, HttpClient http) {
        this.config = config;
        this.json   = objectMapper;
        this.http   = http;
    }

    @Override
    public boolean isConfigured() {
        return config.isConfigured();
    }

    // ------------------------------------------------------------------
    // Repositories
    // ------------------------------------------------------------------

    @Override
    public RepositoryHandle createRepository(String name, String description) {
        log.info("Creating repository '{}'", name);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name",        name);
        body.put("description", description);
        body.put("private",     false);
        // Initialised repos always have a default branch, which the Git Data API needs.
        body.put("auto_init",   true);
        body.put("has_wiki",    false);
        body.put("has_projects", false);

        HttpResponse<String> resp = send("POST", "/user/repos", toJson(body), "createRepository " + name);
        if (resp.statusCode() == 422 && resp.body() != null
                && resp.body().toLowerCase(Locale.ROOT).contains("already exists")) {
            throw new NameCollisionException(name, resp.body());
        }
        RepoResponse repo = parse(requireSuccess(resp, "createRepository " + name),
                RepoResponse.class, "createRepository");
        log.info("Repository created: {}", repo.html_url());
        return toHandle(repo);
    }

    @Override
    public Optional<RepositoryHandle> findRepository(String name) {
        String op = "findRepository " + name;
        HttpResponse<String> resp = send("GET", "/repos/" + config.getUsername() + "/" + name, null, op);
        if (resp.statusCode() == 404) {
            return Optional.empty();
        }
        return Optional.of(toHandle(parse(requireSuccess(resp, op), RepoResponse.class, op)));
    }

    // ------------------------------------------------------------------
    // Branch content and commits
    // ------------------------------------------------------------------

    @Override
    public Optional<BranchSnapshot> readDefaultBranch(RepositoryHandle repo) {
        Optional<String> head = headCommit(repo);
        if (head.isEmpty()) {
            return Optional.empty();
        }
        String treeSha = treeOf(repo, head.get());
        String op = "readTree " + repo.fullName();
        TreeResponse tree = parse(requireSuccess(
                send("GET", repoPath(repo) + "/git/trees/" + treeSha + "?recursive=1", null, op), op),
                TreeResponse.class, op);

        Map<String, String> blobs = new HashMap<>();
        if (tree.tree() != null) {
            for (TreeResponse.Entry entry : tree.tree()) {
                if ("blob".equals(entry.type())) {
                    blobs.put(entry.path(), entry.sha());
                }
            }
        }
        return Optional.of(new BranchSnapshot(head.get(), blobs));
    }

    @Override
    public String commitFiles(RepositoryHandle repo, Map<String, String> files, String message) {
        log.info("Committing {} files to {}@{}", files.size(), repo.fullName(), repo.defaultBranch());
        Optional<String> parent = headCommit(repo);

        // 1. Blobs: unreferenced until the ref moves, so a failure here leaves no trace.
        List<Map<String, Object>> entries = new ArrayList<>();
        for (Map.Entry<String, String> file : files.entrySet()) {
            String blobSha = createBlob(repo, file.getValue());
            entries.add(Map.of(
                    "path", file.getKey(),
                    "mode", "100644",
                    "type", "blob",
                    "sha",  blobSha));
        }

        // 2. Tree on top of the parent's tree so unrelated files are kept.
        Map<String, Object> treeBody = new LinkedHashMap<>();
        parent.ifPresent(p -> treeBody.put("base_tree", treeOf(repo, p)));
        treeBody.put("tree", entries);
        String treeSha = postForSha(repo, "/git/trees", treeBody, "createTree");

        // 3. Commit object.
        Map<String, Object> commitBody = new LinkedHashMap<>();
        commitBody.put("message", message);
        commitBody.put("tree",    treeSha);
        commitBody.put("parents", parent.map(List::of).orElse(List.of()));
        String commitSha = postForSha(repo, "/git/commits", commitBody, "createCommit");

        // 4. Move the branch: the only step that makes anything visible.
        String op = "updateRef " + repo.fullName();
        if (parent.isPresent()) {
            requireSuccess(send("PATCH", repoPath(repo) + "/git/refs/heads/" + repo.defaultBranch(),
                    toJson(Map.of("sha", commitSha, "force", false)), op), op);
        } else {
            requireSuccess(send("POST", repoPath(repo) + "/git/refs",
                    toJson(Map.of("ref", "refs/heads/" + repo.defaultBranch(), "sha", commitSha)), op), op);
        }
        log.info("Branch {} of {} now at {}", repo.defaultBranch(), repo.fullName(), commitSha);
        return commitSha;
    }

    // ------------------------------------------------------------------
    // Pages
    // ------------------------------------------------------------------

    @Override
    public void enablePages(RepositoryHandle repo) {
        String op = "enablePages " + repo.fullName();
        String body = toJson(Map.of("source", Map.of("branch", repo.defaultBranch(), "path", "/")));
        HttpResponse<String> resp = send("POST", repoPath(repo) + "/pages", body, op);
        if (resp.statusCode() == 409) {
            log.info("Pages already enabled for {}", repo.fullName());
            return;
        }
        requireSuccess(resp, op);
        log.info("Pages enabled for {}", repo.fullName());
    }

    @Override
    public Optional<String> findPagesUrl(RepositoryHandle repo) {
        String op = "findPagesUrl " + repo.fullName();
        HttpResponse<String> resp = send("GET", repoPath(repo) + "/pages", null, op);
        if (resp.statusCode() == 404) {
            return Optional.empty();
        }
        PagesResponse pages = parse(requireSuccess(resp, op), PagesResponse.class, op);
        return Optional.ofNullable(pages.html_url()).filter(u -> !u.isBlank());
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private Optional<String> headCommit(RepositoryHandle repo) {
        String op = "readRef " + repo.fullName();
        HttpResponse<String> resp = send("GET",
                repoPath(repo) + "/git/ref/heads/" + repo.defaultBranch(), null, op);
        // 404: no such branch; 409: repository has no commits at all.
        if (resp.statusCode() == 404 || resp.statusCode() == 409) {
            return Optional.empty();
        }
        RefResponse ref = parse(requireSuccess(resp, op), RefResponse.class, op);
        return Optional.of(ref.object().sha());
    }

    private String treeOf(RepositoryHandle repo, String commitSha) {
        String op = "readCommit " + commitSha;
        GitCommitResponse commit = parse(requireSuccess(
                send("GET", repoPath(repo) + "/git/commits/" + commitSha, null, op), op),
                GitCommitResponse.class, op);
        return commit.tree().sha();
    }

    private String createBlob(RepositoryHandle repo, String content) {
        String encoded = Base64.getEncoder().encodeToString(content.getBytes(StandardCharsets.UTF_8));
        return postForSha(repo, "/git/blobs", Map.of("content", encoded, "encoding", "base64"), "createBlob");
    }

    private String postForSha(RepositoryHandle repo, String path, Object body, String opName) {
        String op = opName + " " + repo.fullName();
        String resp = requireSuccess(send("POST", repoPath(repo) + path, toJson(body), op), op);
        return parse(resp, ShaResponse.class, op).sha();
    }

    private String repoPath(RepositoryHandle repo) {
        return "/repos/" + repo.owner() + "/" + repo.name();
    }

    private RepositoryHandle toHandle(RepoResponse repo) {
        String owner  = repo.owner() != null ? repo.owner().login() : config.getUsername();
        String branch = repo.default_branch() != null ? repo.default_branch() : config.getBranch();
        return new RepositoryHandle(owner, repo.name(), repo.html_url(), branch);
    }

    /** Send one request; returns the raw response whatever its status. */
    private HttpResponse<String> send(String method, String path, String jsonBody, String opName) {
        if (!isConfigured()) {
            throw new HostingException(opName + " failed: GitHub credentials are not configured", 401, false);
        }
        HttpRequest.BodyPublisher publisher = jsonBody == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(jsonBody);
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(config.getApiUrl() + path))
                .timeout(config.getRequestTimeout())
                .header("Authorization",        "Bearer " + config.getToken())
                .header("Accept",               ACCEPT)
                .header("X-GitHub-Api-Version", API_VERSION)
                .header("Content-Type",         "application/json")
                .method(method, publisher)
                .build();
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw HostingException.unreachable(opName, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HostingException(opName + " interrupted", HostingException.NO_RESPONSE, false, e);
        }
    }

    /** Returns the body of a 2xx response, otherwise throws a classified HostingException. */
    private String requireSuccess(HttpResponse<String> resp, String opName) {
        int status = resp.statusCode();
        if (status >= 200 && status < 300) {
            return resp.body();
        }
        throw new HostingException(opName + " failed: HTTP " + status + ": " + resp.body(),
                status, isTransient(resp));
    }

    /** 429, 5xx and 403-with-exhausted-rate-limit are worth retrying. */
    private static boolean isTransient(HttpResponse<String> resp) {
        int status = resp.statusCode();
        if (status == 429 || status >= 500) {
            return true;
        }
        if (status == 403) {
            boolean exhausted = resp.headers().firstValue("x-ratelimit-remaining")
                    .map("0"::equals).orElse(false);
            String body = resp.body() == null ? "" : resp.body().toLowerCase(Locale.ROOT);
            return exhausted || body.contains("rate limit");
        }
        return false;
    }

    private <T> T parse(String body, Class<T> type, String opName) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new HostingException("Failed to parse " + opName + " response", 200, false, e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new HostingException("JSON serialization failed", HostingException.NO_RESPONSE, false, e);
        }
    }
}
