package com.pagesmith.orchestrator.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One accepted submission, keyed by its nonce.
 *
 * Records are owned by the {@code TaskRecordRepository}: every mutation happens
 * inside {@code TaskRecordRepository.update}, which serializes writers per nonce,
 * and readers only ever see copies. The class itself therefore does no locking;
 * it only enforces the record-level rules:
 * <ul>
 *   <li>state changes follow {@link TaskState#canTransitionTo}, never backwards</li>
 *   <li>repository URL, pages URL and commit SHA are write-once</li>
 *   <li>{@code error} is only present once the record is FAILED</li>
 * </ul>
 */
public class TaskRecord {

    private final String nonce;
    private final String email;
    private final String taskName;
    private final int    round;
    private final String brief;
    private final Map<String, byte[]> attachments;
    private final List<String> checks;
    private final String evaluationUrl;
    private final String callerEndpoint;

    private TaskState state = TaskState.QUEUED;

    // Set once GENERATING finishes; the record owns the artifact from then on.
    private String generatedArtifact;

    private String repositoryName;
    private String repositoryUrl;
    private String pagesUrl;
    private String commitSha;

    private TaskError error;

    // Non-fatal problems (PublishDegraded, NotificationFailed) in the order they happened.
    private final List<TaskError> warnings = new ArrayList<>();

    private final Instant createdAt;
    private Instant updatedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    public TaskRecord(TaskSubmission submission) {
        this.nonce          = Objects.requireNonNull(submission.nonce(), "nonce");
        this.email          = submission.email();
        this.taskName       = submission.taskName();
        this.round          = submission.round();
        this.brief          = submission.brief();
        this.attachments    = submission.attachments();
        this.checks         = submission.checks();
        this.evaluationUrl  = submission.evaluationUrl();
        this.callerEndpoint = submission.callerEndpoint();
        this.createdAt      = Instant.now();
        this.updatedAt      = createdAt;
    }

    private TaskRecord(TaskRecord other) {
        this.nonce             = other.nonce;
        this.email             = other.email;
        this.taskName          = other.taskName;
        this.round             = other.round;
        this.brief             = other.brief;
        this.attachments       = other.attachments;
        this.checks            = other.checks;
        this.evaluationUrl     = other.evaluationUrl;
        this.callerEndpoint    = other.callerEndpoint;
        this.state             = other.state;
        this.generatedArtifact = other.generatedArtifact;
        this.repositoryName    = other.repositoryName;
        this.repositoryUrl     = other.repositoryUrl;
        this.pagesUrl          = other.pagesUrl;
        this.commitSha         = other.commitSha;
        this.error             = other.error;
        this.warnings.addAll(other.warnings);
        this.createdAt         = other.createdAt;
        this.updatedAt         = other.updatedAt;
    }

    /** Detached copy handed to readers. */
    public TaskRecord copy() {
        return new TaskRecord(this);
    }

    // ------------------------------------------------------------------
    // Mutations
    // ------------------------------------------------------------------

    /**
     * Move to {@code next}.
     *
     * @throws IllegalStateException if the state machine does not allow it
     */
    public void transitionTo(TaskState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Task %s cannot move from %s to %s".formatted(nonce, state, next));
        }
        state = next;
        touch();
    }

    /** Move to FAILED and record the fatal cause. */
    public void fail(TaskError cause) {
        transitionTo(TaskState.FAILED);
        this.error = Objects.requireNonNull(cause, "cause");
    }

    public void addWarning(TaskError warning) {
        warnings.add(warning);
        touch();
    }

    public void setGeneratedArtifact(String html) {
        this.generatedArtifact = html;
        touch();
    }

    public void setRepository(RepositoryHandle handle) {
        this.repositoryName = writeOnce("repositoryName", repositoryName, handle.name());
        this.repositoryUrl  = writeOnce("repositoryUrl", repositoryUrl, handle.htmlUrl());
        touch();
    }

    public void setPagesUrl(String url) {
        this.pagesUrl = writeOnce("pagesUrl", pagesUrl, url);
        touch();
    }

    public void setCommitSha(String sha) {
        this.commitSha = writeOnce("commitSha", commitSha, sha);
        touch();
    }

    private String writeOnce(String field, String current, String value) {
        if (current != null && !current.equals(value)) {
            throw new IllegalStateException(
                    "Task %s: %s is already set to %s".formatted(nonce, field, current));
        }
        return value;
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String    getNonce()             { return nonce; }
    public String    getEmail()             { return email; }
    public String    getTaskName()          { return taskName; }
    public int       getRound()             { return round; }
    public String    getBrief()             { return brief; }
    public Map<String, byte[]> getAttachments() { return attachments; }
    public List<String> getChecks()         { return checks; }
    public String    getEvaluationUrl()     { return evaluationUrl; }
    public String    getCallerEndpoint()    { return callerEndpoint; }
    public TaskState getState()             { return state; }
    public String    getGeneratedArtifact() { return generatedArtifact; }
    public String    getRepositoryName()    { return repositoryName; }
    public String    getRepositoryUrl()     { return repositoryUrl; }
    public String    getPagesUrl()          { return pagesUrl; }
    public String    getCommitSha()         { return commitSha; }
    public TaskError getError()             { return error; }
    public List<TaskError> getWarnings()    { return List.copyOf(warnings); }
    public Instant   getCreatedAt()         { return createdAt; }
    public Instant   getUpdatedAt()         { return updatedAt; }
}
