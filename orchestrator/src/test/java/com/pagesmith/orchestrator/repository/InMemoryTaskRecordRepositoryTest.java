package com.pagesmith.orchestrator.repository;

import com.pagesmith.orchestrator.model.ErrorKind;
import com.pagesmith.orchestrator.model.TaskError;
import com.pagesmith.orchestrator.model.TaskRecord;
import com.pagesmith.orchestrator.model.TaskState;
import com.pagesmith.orchestrator.model.TaskSubmission;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryTaskRecordRepositoryTest {

    private final InMemoryTaskRecordRepository repo = new InMemoryTaskRecordRepository();

    private static TaskRecord record(String nonce) {
        return new TaskRecord(new TaskSubmission("a@b.c", "demo", 1, nonce, "brief",
                Map.of(), List.of(), "https://eval.example/cb", null));
    }

    @Test
    void create_thenFind_returnsCopy() {
        repo.create(record("n-1"));

        TaskRecord found = repo.findByNonce("n-1").orElseThrow();
        found.transitionTo(TaskState.GENERATING);   // mutating the copy...

        assertThat(repo.findByNonce("n-1").orElseThrow().getState())
                .isEqualTo(TaskState.QUEUED);       // ...does not touch the store
    }

    @Test
    void create_duplicateNonce_throwsAndKeepsOriginal() {
        repo.create(record("n-1"));
        repo.update("n-1", r -> r.transitionTo(TaskState.GENERATING));

        assertThatThrownBy(() -> repo.create(record("n-1")))
                .isInstanceOf(DuplicateNonceException.class);
        assertThat(repo.findByNonce("n-1").orElseThrow().getState()).isEqualTo(TaskState.GENERATING);
    }

    @Test
    void update_unknownNonce_throws() {
        assertThatThrownBy(() -> repo.update("missing", r -> r.transitionTo(TaskState.GENERATING)))
                .isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void update_rejectedMutation_leavesRecordUnchanged() {
        repo.create(record("n-1"));

        assertThatThrownBy(() -> repo.update("n-1", r -> {
            r.addWarning(TaskError.of(ErrorKind.PUBLISH_DEGRADED, "half-written"));
            r.transitionTo(TaskState.COMPLETED);    // illegal from QUEUED
        })).isInstanceOf(IllegalStateException.class);

        TaskRecord stored = repo.findByNonce("n-1").orElseThrow();
        assertThat(stored.getState()).isEqualTo(TaskState.QUEUED);
        assertThat(stored.getWarnings()).isEmpty();
    }

    @Test
    void countActive_ignoresTerminalRecords() {
        repo.create(record("a"));
        repo.create(record("b"));
        repo.update("b", r -> r.fail(TaskError.of(ErrorKind.INTERNAL, "boom")));

        assertThat(repo.countActive()).isEqualTo(1);
        assertThat(repo.findAll()).extracting(TaskRecord::getNonce).containsExactlyInAnyOrder("a", "b");
    }

    @Test
    void concurrentUpdates_toOneNonce_areSerialized() throws Exception {
        repo.create(record("n-1"));
        int writers = 8;
        int perWriter = 250;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perWriter; i++) {
                        repo.update("n-1", r -> r.addWarning(TaskError.of(ErrorKind.NOTIFICATION_FAILED, "x")));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        // No lost updates: every append survived.
        assertThat(repo.findByNonce("n-1").orElseThrow().getWarnings()).hasSize(writers * perWriter);
    }

    @Test
    void onlyOneConcurrentFinalizer_wins() throws Exception {
        repo.create(record("n-1"));
        repo.update("n-1", r -> r.transitionTo(TaskState.GENERATING));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<Boolean> failer = pool.submit(() -> {
                start.await();
                return attempt(() -> repo.update("n-1",
                        r -> r.fail(TaskError.of(ErrorKind.BUDGET_EXCEEDED, "late"))));
            });
            Future<Boolean> advancer = pool.submit(() -> {
                start.await();
                return attempt(() -> repo.update("n-1", r -> r.transitionTo(TaskState.COMMITTING)));
            });
            start.countDown();
            boolean failed = failer.get(5, TimeUnit.SECONDS);
            boolean advanced = advancer.get(5, TimeUnit.SECONDS);

            TaskState finalState = repo.findByNonce("n-1").orElseThrow().getState();
            // Either order is legal, but the record ends FAILED and the failer always succeeds.
            assertThat(failed).isTrue();
            assertThat(finalState).isEqualTo(TaskState.FAILED);
            if (!advanced) {
                assertThat(repo.findByNonce("n-1").orElseThrow().getError()).isNotNull();
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private static boolean attempt(Runnable r) {
        try {
            r.run();
            return true;
        } catch (IllegalStateException e) {
            return false;
        }
    }
}
