package com.pagesmith.orchestrator.service;

import com.pagesmith.orchestrator.generation.CodeGenerationStage;
import com.pagesmith.orchestrator.hosting.InMemoryHostingProvider;
import com.pagesmith.orchestrator.llm.ChatCompletionsClient;
import com.pagesmith.orchestrator.llm.LlmApiException;
import com.pagesmith.orchestrator.model.ErrorKind;
import com.pagesmith.orchestrator.model.StageFailureException;
import com.pagesmith.orchestrator.model.TaskError;
import com.pagesmith.orchestrator.model.TaskRecord;
import com.pagesmith.orchestrator.model.TaskState;
import com.pagesmith.orchestrator.model.TaskSubmission;
import com.pagesmith.orchestrator.repository.DuplicateNonceException;
import com.pagesmith.orchestrator.repository.InMemoryTaskRecordRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * End-to-end runs of the pipeline with real stages, the in-memory hosting
 * double, a model client that always fails (so the template page is used) and
 * a mocked callback notifier.
 */
@ExtendWith(MockitoExtension.class)
class TaskOrchestratorTest {

    private static final String EVAL_URL = "https://eval.example/notify";

    @Mock ChatCompletionsClient llm;
    @Mock CallbackNotifier      notifier;

    InMemoryHostingProvider      hosting;
    InMemoryTaskRecordRepository store;
    SimpleMeterRegistry          meters;
    TaskOrchestrator             orchestrator;

    @BeforeEach
    void setUp() throws Exception {
        lenient().when(llm.isConfigured()).thenReturn(true);
        lenient().when(llm.complete(any())).thenThrow(new LlmApiException(500, "model is down"));

        hosting = new InMemoryHostingProvider();
        store   = new InMemoryTaskRecordRepository();
        meters  = new SimpleMeterRegistry();
        orchestrator = newOrchestrator(Duration.ofSeconds(30));
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    private TaskOrchestrator newOrchestrator(Duration budget) {
        return new TaskOrchestrator(store,
                new CodeGenerationStage(llm, meters),
                new RepositoryLifecycleManager(hosting, RetryPolicy.immediate(3), "tds", 5),
                new PagesPublisher(hosting, RetryPolicy.immediate(2)),
                notifier, meters, "Pagesmith", budget, 4);
    }

    private static TaskSubmission task(String nonce, String name, int round, String brief) {
        return task("student@example.com", nonce, name, round, brief);
    }

    private static TaskSubmission task(String email, String nonce, String name, int round, String brief) {
        return new TaskSubmission(email, name, round, nonce, brief,
                Map.of(), List.of(), EVAL_URL, null);
    }

    private TaskRecord awaitTerminal(String nonce) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (System.nanoTime() < deadline) {
            TaskRecord r = store.findByNonce(nonce).orElseThrow();
            if (r.getState().isTerminal()) {
                return r;
            }
            Thread.sleep(20);
        }
        throw new AssertionError("Task " + nonce + " did not finish: "
                + store.findByNonce(nonce).orElseThrow().getState());
    }

    private CallbackPayload lastCallback() throws InterruptedException {
        ArgumentCaptor<CallbackPayload> captor = ArgumentCaptor.forClass(CallbackPayload.class);
        verify(notifier, timeout(5000).atLeastOnce()).notify(eq(EVAL_URL), captor.capture());
        return captor.getValue();
    }

    // ------------------------------------------------------------------
    // Scenarios
    // ------------------------------------------------------------------

    @Test
    void failingProvider_stillCompletes_withTemplatePageAndPagesUrl() throws Exception {
        TaskRecord accepted = orchestrator.submit(task("t-1", "t-1", 1, "page with h1#title and button#btn"));
        assertThat(accepted.getState()).isEqualTo(TaskState.QUEUED);

        TaskRecord done = awaitTerminal("t-1");

        assertThat(done.getState()).isEqualTo(TaskState.COMPLETED);
        assertThat(done.getError()).isNull();
        assertThat(done.getGeneratedArtifact()).contains("id=\"title\"", "id=\"btn\"");
        assertThat(done.getCommitSha()).isNotBlank();

        CallbackPayload payload = lastCallback();
        assertThat(payload.status()).isEqualTo("completed");
        assertThat(payload.nonce()).isEqualTo("t-1");
        assertThat(payload.pagesUrl()).isNotBlank();
        assertThat(payload.repoUrl()).isEqualTo(done.getRepositoryUrl());
        assertThat(meters.counter("pagesmith.generation.fallback", "reason", "provider_error").count())
                .isEqualTo(1.0);
    }

    @Test
    void roundTwo_reusesRepository_andUpdatesArtifact() throws Exception {
        orchestrator.submit(task("r-1", "weather", 1, "page with h1#title"));
        TaskRecord first = awaitTerminal("r-1");

        orchestrator.submit(task("r-2", "weather", 2, "page with h1#title and a p#forecast"));
        TaskRecord second = awaitTerminal("r-2");

        assertThat(second.getState()).isEqualTo(TaskState.COMPLETED);
        assertThat(second.getRepositoryUrl()).isEqualTo(first.getRepositoryUrl());
        assertThat(hosting.repositoryNames()).containsExactly("tds-weather-student");
        assertThat(hosting.createCalls()).isEqualTo(1);

        Map<String, String> head = hosting.headFiles("tds-weather-student");
        assertThat(head.get("index.html")).contains("id=\"forecast\"");
        assertThat(head).containsKey("round-2-updates.md");
        assertThat(second.getCommitSha()).isNotEqualTo(first.getCommitSha());
    }

    @Test
    void sameTask_fromTwoRequesters_neverShareARepository() throws Exception {
        orchestrator.submit(task("ann@example.com", "a-1", "weather", 1, "page with h1#ann"));
        TaskRecord ann = awaitTerminal("a-1");
        orchestrator.submit(task("ben@example.com", "b-1", "weather", 1, "page with h1#ben"));
        TaskRecord ben = awaitTerminal("b-1");

        assertThat(ann.getRepositoryUrl()).isNotEqualTo(ben.getRepositoryUrl());
        assertThat(hosting.repositoryNames()).containsExactly("tds-weather-ann", "tds-weather-ben");
        assertThat(hosting.headFiles("tds-weather-ann").get("index.html")).contains("id=\"ann\"");
        assertThat(hosting.headFiles("tds-weather-ben").get("index.html")).contains("id=\"ben\"");
        assertThat(lastCallback().repoUrl()).isEqualTo(ben.getRepositoryUrl());
    }

    @Test
    void unreachableHosting_failsWithRepositoryUnavailable_andReportsFailure() throws Exception {
        hosting.setUnreachable(true);

        orchestrator.submit(task("h-1", "demo", 1, "page with h1#title"));
        TaskRecord done = awaitTerminal("h-1");

        assertThat(done.getState()).isEqualTo(TaskState.FAILED);
        assertThat(done.getError().kind()).isEqualTo(ErrorKind.REPOSITORY_UNAVAILABLE);
        assertThat(done.getPagesUrl()).isNull();

        CallbackPayload payload = lastCallback();
        assertThat(payload.status()).isEqualTo("failed");
        assertThat(payload.error().kind()).isEqualTo("RepositoryUnavailable");
        verify(notifier, times(1)).notify(any(), any());
    }

    @Test
    void budgetExpiry_failsRun_discardsLateResult_andReportsOnce() throws Exception {
        orchestrator.shutdown();
        orchestrator = newOrchestrator(Duration.ofMillis(300));
        CountDownLatch neverOpened = new CountDownLatch(1);
        hosting.blockCommitsUntil(neverOpened);

        orchestrator.submit(task("b-1", "slow", 1, "page with h1#title"));
        TaskRecord done = awaitTerminal("b-1");

        assertThat(done.getState()).isEqualTo(TaskState.FAILED);
        assertThat(done.getError().kind()).isEqualTo(ErrorKind.BUDGET_EXCEEDED);

        CallbackPayload payload = lastCallback();
        assertThat(payload.status()).isEqualTo("failed");
        assertThat(payload.error().kind()).isEqualTo("BudgetExceeded");

        // The abandoned worker must not overwrite the outcome or report again.
        Thread.sleep(200);
        TaskRecord later = store.findByNonce("b-1").orElseThrow();
        assertThat(later.getState()).isEqualTo(TaskState.FAILED);
        assertThat(later.getCommitSha()).isNull();
        verify(notifier, times(1)).notify(any(), any());
        assertThat(hosting.commits("tds-slow-student")).hasSize(1);   // only the initial commit
    }

    @Test
    void publishFailure_degrades_butStillCompletes() throws Exception {
        hosting.setPagesBroken(true);

        orchestrator.submit(task("p-1", "demo", 1, "page with h1#title"));
        TaskRecord done = awaitTerminal("p-1");

        assertThat(done.getState()).isEqualTo(TaskState.COMPLETED);
        assertThat(done.getPagesUrl()).isNull();
        assertThat(done.getWarnings()).extracting(TaskError::kind).containsExactly(ErrorKind.PUBLISH_DEGRADED);
        assertThat(lastCallback().status()).isEqualTo("completed");
    }

    @Test
    void undeliverableCallback_isRecordedAsWarning_withoutChangingOutcome() throws Exception {
        doThrow(new StageFailureException(ErrorKind.NOTIFICATION_FAILED, "endpoint down"))
                .when(notifier).notify(any(), any());

        orchestrator.submit(task("c-1", "demo", 1, "page with h1#title"));
        TaskRecord done = awaitTerminal("c-1");

        assertThat(done.getState()).isEqualTo(TaskState.COMPLETED);
        assertThat(done.getWarnings()).extracting(TaskError::kind).containsExactly(ErrorKind.NOTIFICATION_FAILED);
    }

    @Test
    void duplicateNonce_isRejected_withoutSecondRun() throws Exception {
        orchestrator.submit(task("d-1", "demo", 1, "page with h1#title"));

        assertThatThrownBy(() -> orchestrator.submit(task("d-1", "demo", 1, "something else")))
                .isInstanceOf(DuplicateNonceException.class);

        awaitTerminal("d-1");
        verify(notifier, timeout(5000).times(1)).notify(any(), any());
        assertThat(orchestrator.findAll()).hasSize(1);
    }

    @Test
    void unrelatedTasks_runConcurrently_andAllFinish() throws Exception {
        for (int i = 0; i < 6; i++) {
            orchestrator.submit(task("m-" + i, "task-" + i, 1, "page with h1#title"));
        }
        for (int i = 0; i < 6; i++) {
            assertThat(awaitTerminal("m-" + i).getState()).isEqualTo(TaskState.COMPLETED);
        }
        assertThat(hosting.repositoryNames()).hasSize(6);
        assertThat(orchestrator.activeTasks()).isZero();
        assertThat(meters.counter("pagesmith.tasks.finished", "state", "completed").count()).isEqualTo(6.0);
    }
}
