package com.pagesmith.orchestrator.service;

import com.pagesmith.orchestrator.config.PagesmithProperties;
import com.pagesmith.orchestrator.generation.CodeGenerationStage;
import com.pagesmith.orchestrator.generation.GeneratedArtifact;
import com.pagesmith.orchestrator.model.CommitResult;
import com.pagesmith.orchestrator.model.ErrorKind;
import com.pagesmith.orchestrator.model.RepositoryHandle;
import com.pagesmith.orchestrator.model.StageFailureException;
import com.pagesmith.orchestrator.model.TaskError;
import com.pagesmith.orchestrator.model.TaskRecord;
import com.pagesmith.orchestrator.model.TaskState;
import com.pagesmith.orchestrator.model.TaskSubmission;
import com.pagesmith.orchestrator.repository.DuplicateNonceException;
import com.pagesmith.orchestrator.repository.TaskRecordRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Year;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Drives each accepted task through the pipeline
 * {@code queued → generating → committing → publishing → notifying → completed}.
 *
 * <h3>Scheduling</h3>
 * {@link #submit} stores the record and hands the run to a fixed worker pool; it
 * never waits on a stage. The pool size is the concurrency ceiling that keeps us
 * inside the model's and GitHub's rate limits. Unrelated tasks never wait on each
 * other except for a free worker.
 *
 * <h3>Budget</h3>
 * A watchdog fires {@code budget} after acceptance. If the record is still
 * running it is failed with {@code BudgetExceeded}, the worker is interrupted,
 * and the failure callback goes out from the watchdog side. Whatever the
 * interrupted stage returns afterwards is discarded: every write by the worker is
 * rejected once the record is terminal.
 *
 * <h3>Failure policy</h3>
 * <ul>
 *   <li>generation never fails (fallback page)</li>
 *   <li>commit failures are fatal: FAILED, then a failure callback</li>
 *   <li>publish failures are recorded as a {@code PublishDegraded} warning and the run goes on</li>
 *   <li>callback failures are recorded as a {@code NotificationFailed} warning and change nothing else</li>
 * </ul>
 * Whoever moves a record into a terminal state owns its callback, so each
 * record is reported once.
 */
@Service
public class TaskOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TaskOrchestrator.class);

    static final String STATUS_COMPLETED = "completed";
    static final String STATUS_FAILED    = "failed";

    private final TaskRecordRepository       repository;
    private final CodeGenerationStage        generation;
    private final RepositoryLifecycleManager repositories;
    private final PagesPublisher             publisher;
    private final CallbackNotifier           notifier;
    private final MeterRegistry              meters;
    private final String                     licenseHolder;
    private final Duration                   budget;

    private final ExecutorService          workers;
    private final ScheduledExecutorService watchdog;
    // Failure callbacks for expired runs; kept off the watchdog thread so one slow
    // endpoint cannot delay the next expiry.
    private final ExecutorService          expiryCallbacks;

    private final Map<String, Future<?>>          running   = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> deadlines = new ConcurrentHashMap<>();

    @Autowired
    public TaskOrchestrator(TaskRecordRepository repository,
                            CodeGenerationStage generation,
                            RepositoryLifecycleManager repositories,
                            PagesPublisher publisher,
                            CallbackNotifier notifier,
                            MeterRegistry meters,
                            PagesmithProperties properties) {
        this(repository, generation, repositories, publisher, notifier, meters,
             properties.getLicenseHolder(),
             properties.getOrchestrator().getBudget(),
             properties.getOrchestrator().getMaxConcurrentTasks());
    }

    TaskOrchestrator(TaskRecordRepository repository,
                     CodeGenerationStage generation,
                     RepositoryLifecycleManager repositories,
                     PagesPublisher publisher,
                     CallbackNotifier notifier,
                     MeterRegistry meters,
                     String licenseHolder,
                     Duration budget,
                     int maxConcurrentTasks) {
        this.repository      = repository;
        this.generation      = generation;
        this.repositories    = repositories;
        this.publisher       = publisher;
        this.notifier        = notifier;
        this.meters          = meters;
        this.licenseHolder   = licenseHolder;
        this.budget          = budget;
        this.workers         = Executors.newFixedThreadPool(maxConcurrentTasks, named("task-worker"));
        this.watchdog        = Executors.newSingleThreadScheduledExecutor(named("task-watchdog"));
        this.expiryCallbacks = Executors.newCachedThreadPool(named("task-expiry"));
    }

    // ------------------------------------------------------------------
    // Acceptance and queries
    // ------------------------------------------------------------------

    /**
     * Accept a task: store it as QUEUED and schedule its run.
     *
     * @return a copy of the stored record
     * @throws DuplicateNonceException if the nonce was accepted before; nothing is scheduled then
     */
    public TaskRecord submit(TaskSubmission submission) {
        TaskRecord stored = repository.create(new TaskRecord(submission));
        String nonce = stored.getNonce();
        log.info("Accepted task '{}' round {} (nonce={})", stored.getTaskName(), stored.getRound(), nonce);

        FutureTask<Void> run = new FutureTask<>(() -> execute(nonce), null);
        running.put(nonce, run);
        workers.execute(run);
        deadlines.put(nonce, watchdog.schedule(() -> expire(nonce), budget.toMillis(), TimeUnit.MILLISECONDS));
        return stored;
    }

    public Optional<TaskRecord> findByNonce(String nonce) {
        return repository.findByNonce(nonce);
    }

    public List<TaskRecord> findAll() {
        return repository.findAll();
    }

    public long activeTasks() {
        return repository.countActive();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down, {} task(s) still active", activeTasks());
        watchdog.shutdownNow();
        workers.shutdownNow();
        expiryCallbacks.shutdown();
    }

    // ------------------------------------------------------------------
    // One run
    // ------------------------------------------------------------------

    /** Run the whole pipeline for {@code nonce} on the calling thread. */
    void execute(String nonce) {
        TaskRecord record = repository.findByNonce(nonce).orElseThrow();
        MDC.put("nonce", nonce);
        MDC.put("task",  record.getTaskName());
        MDC.put("round", String.valueOf(record.getRound()));
        try {
            runPipeline(record);
        } catch (InterruptedException e) {
            log.warn("Run abandoned while in progress");
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            if (isTerminal(nonce)) {
                log.info("Discarding late result: {}", e.getMessage());
            } else {
                log.error("Unexpected failure", e);
                failAndNotify(nonce, TaskError.of(ErrorKind.INTERNAL,
                        e.getClass().getSimpleName() + ": " + e.getMessage()));
            }
        } finally {
            running.remove(nonce);
            ScheduledFuture<?> deadline = deadlines.remove(nonce);
            if (deadline != null) {
                deadline.cancel(false);
            }
            MDC.clear();
        }
    }

    private void runPipeline(TaskRecord task) throws InterruptedException {
        String nonce = task.getNonce();

        // ── generating ───────────────────────────────────────────────────
        advance(nonce, TaskState.GENERATING);
        GeneratedArtifact artifact = timed("generate", () -> generation.generate(
                task.getTaskName(), task.getBrief(), task.getAttachments(), task.getChecks()));
        if (artifact.isFallback()) {
            log.info("Using {} page ({})", artifact.source(), artifact.fallbackReason());
        }
        record(nonce, r -> r.setGeneratedArtifact(artifact.html()));

        // ── committing ───────────────────────────────────────────────────
        advance(nonce, TaskState.COMMITTING);
        RepositoryHandle repo;
        try {
            repo = timed("commit", () -> commit(task, artifact));
        } catch (StageFailureException e) {
            log.error("Commit stage failed: {}", e.getMessage());
            failAndNotify(nonce, e.getError());
            return;
        }

        // ── publishing ───────────────────────────────────────────────────
        advance(nonce, TaskState.PUBLISHING);
        try {
            String pagesUrl = timed("publish", () -> publisher.ensurePublished(repo));
            record(nonce, r -> r.setPagesUrl(pagesUrl));
        } catch (StageFailureException e) {
            log.warn("Publishing degraded: {}", e.getMessage());
            record(nonce, r -> r.addWarning(e.getError()));
        }

        // ── notifying ────────────────────────────────────────────────────
        advance(nonce, TaskState.NOTIFYING);
        notifyCaller(nonce, STATUS_COMPLETED);
        advance(nonce, TaskState.COMPLETED);
        meters.counter("pagesmith.tasks.finished", "state", TaskState.COMPLETED.wireName()).increment();
        log.info("Task completed");
    }

    private RepositoryHandle commit(TaskRecord task, GeneratedArtifact artifact) throws InterruptedException {
        RepositoryHandle repo = repositories.ensureRepository(task.getEmail(), task.getTaskName(), task.getRound());
        record(task.getNonce(), r -> r.setRepository(repo));

        Map<String, String> files = ProjectFiles.render(
                task.getTaskName(), task.getRound(), task.getBrief(), task.getChecks(),
                artifact.html(), repo, PagesPublisher.defaultUrl(repo), licenseHolder, Year.now());
        CommitResult commit = repositories.commitFiles(
                repo, files, ProjectFiles.commitMessage(task.getRound(), task.getBrief()));
        record(task.getNonce(), r -> r.setCommitSha(commit.commitSha()));
        return repo;
    }

    // ------------------------------------------------------------------
    // Budget
    // ------------------------------------------------------------------

    private void expire(String nonce) {
        deadlines.remove(nonce);
        TaskError cause = TaskError.of(ErrorKind.BUDGET_EXCEEDED,
                "Not finished within " + budget.toSeconds() + "s");
        if (!finalizeFailure(nonce, cause)) {
            return;
        }
        log.warn("Task {} exceeded its {}s budget, abandoning it", nonce, budget.toSeconds());
        Future<?> run = running.remove(nonce);
        if (run != null) {
            run.cancel(true);
        }
        expiryCallbacks.execute(() -> {
            MDC.put("nonce", nonce);
            try {
                notifyCaller(nonce, STATUS_FAILED);
            } catch (InterruptedException e) {
                log.warn("Failure callback for {} interrupted by shutdown", nonce);
                Thread.currentThread().interrupt();
            } finally {
                MDC.clear();
            }
        });
    }

    // ------------------------------------------------------------------
    // State changes
    // ------------------------------------------------------------------

    private void advance(String nonce, TaskState next) {
        repository.update(nonce, r -> r.transitionTo(next));
        MDC.put("stage", next.wireName());
        log.info("→ {}", next.wireName());
    }

    /** Apply a write from the running stage; rejected once the record is terminal. */
    private void record(String nonce, Consumer<TaskRecord> mutation) {
        repository.update(nonce, r -> {
            if (r.getState().isTerminal()) {
                throw new IllegalStateException("Task " + nonce + " is already " + r.getState().wireName());
            }
            mutation.accept(r);
        });
    }

    /**
     * Move the record to FAILED unless it is terminal already.
     *
     * @return true if this call did the transition, i.e. owns the failure callback
     */
    private boolean finalizeFailure(String nonce, TaskError cause) {
        boolean[] mine = {false};
        repository.update(nonce, r -> {
            if (!r.getState().isTerminal()) {
                r.fail(cause);
                mine[0] = true;
            }
        });
        if (mine[0]) {
            meters.counter("pagesmith.tasks.finished", "state", TaskState.FAILED.wireName()).increment();
        }
        return mine[0];
    }

    private void failAndNotify(String nonce, TaskError cause) {
        if (!finalizeFailure(nonce, cause)) {
            log.info("Task already finished, not reporting {}", cause.kind().wireName());
            return;
        }
        log.error("Task failed: [{}] {}", cause.kind().wireName(), cause.message());
        try {
            notifyCaller(nonce, STATUS_FAILED);
        } catch (InterruptedException e) {
            log.warn("Failure callback interrupted");
            Thread.currentThread().interrupt();
        }
    }

    /** Send the callback; an undeliverable callback only adds a warning. */
    private void notifyCaller(String nonce, String status) throws InterruptedException {
        TaskRecord snapshot = repository.findByNonce(nonce).orElseThrow();
        try {
            timed("notify", () -> {
                notifier.notify(snapshot.getEvaluationUrl(), CallbackPayload.from(snapshot, status));
                return null;
            });
        } catch (StageFailureException e) {
            log.warn("Callback not delivered: {}", e.getMessage());
            repository.update(nonce, r -> r.addWarning(e.getError()));
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    @FunctionalInterface
    private interface StageCall<T> {
        T run() throws InterruptedException;
    }

    private <T> T timed(String stage, StageCall<T> call) throws InterruptedException {
        Timer.Sample sample = Timer.start(meters);
        String outcome = "error";
        try {
            T result = call.run();
            outcome = "success";
            return result;
        } catch (StageFailureException e) {
            outcome = e.getKind().isFatal() ? "failed" : "degraded";
            throw e;
        } catch (InterruptedException e) {
            outcome = "abandoned";
            throw e;
        } finally {
            sample.stop(meters.timer("pagesmith.stage.duration", "stage", stage, "outcome", outcome));
        }
    }

    private boolean isTerminal(String nonce) {
        return repository.findByNonce(nonce).map(r -> r.getState().isTerminal()).orElse(true);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
