package com.pagesmith.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Record-level rules: forward-only state machine, write-once URLs, error only on FAILED.
 */
class TaskRecordTest {

    private static TaskRecord newRecord() {
        return new TaskRecord(new TaskSubmission("a@b.c", "demo", 1, "n-1", "brief",
                Map.of(), List.of(), "https://eval.example/cb", null));
    }

    // ------------------------------------------------------------------
    // State machine
    // ------------------------------------------------------------------

    @Test
    void happyPath_walksEveryStateInOrder() {
        TaskRecord r = newRecord();
        for (TaskState s : List.of(TaskState.GENERATING, TaskState.COMMITTING, TaskState.PUBLISHING,
                                   TaskState.NOTIFYING, TaskState.COMPLETED)) {
            r.transitionTo(s);
        }
        assertThat(r.getState()).isEqualTo(TaskState.COMPLETED);
        assertThat(r.getState().isTerminal()).isTrue();
    }

    @Test
    void backwardTransition_isRejected() {
        TaskRecord r = newRecord();
        r.transitionTo(TaskState.GENERATING);
        r.transitionTo(TaskState.COMMITTING);

        assertThatThrownBy(() -> r.transitionTo(TaskState.GENERATING))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("COMMITTING");
        assertThat(r.getState()).isEqualTo(TaskState.COMMITTING);
    }

    @Test
    void skippingAStage_isRejected() {
        TaskRecord r = newRecord();
        assertThatThrownBy(() -> r.transitionTo(TaskState.PUBLISHING))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void terminalStates_haveNoSuccessors() {
        for (TaskState next : TaskState.values()) {
            assertThat(TaskState.COMPLETED.canTransitionTo(next)).isFalse();
            assertThat(TaskState.FAILED.canTransitionTo(next)).isFalse();
        }
    }

    @Test
    void everyNonTerminalState_canFail() {
        for (TaskState s : TaskState.values()) {
            assertThat(s.canTransitionTo(TaskState.FAILED)).isEqualTo(!s.isTerminal());
        }
    }

    @Test
    void fail_setsErrorAndState() {
        TaskRecord r = newRecord();
        r.transitionTo(TaskState.GENERATING);
        r.fail(TaskError.of(ErrorKind.BUDGET_EXCEEDED, "too slow"));

        assertThat(r.getState()).isEqualTo(TaskState.FAILED);
        assertThat(r.getError().kind()).isEqualTo(ErrorKind.BUDGET_EXCEEDED);
    }

    @Test
    void fail_afterCompletion_isRejectedAndLeavesNoError() {
        TaskRecord r = newRecord();
        r.transitionTo(TaskState.GENERATING);
        r.transitionTo(TaskState.COMMITTING);
        r.transitionTo(TaskState.PUBLISHING);
        r.transitionTo(TaskState.NOTIFYING);
        r.transitionTo(TaskState.COMPLETED);

        assertThatThrownBy(() -> r.fail(TaskError.of(ErrorKind.INTERNAL, "late")))
                .isInstanceOf(IllegalStateException.class);
        assertThat(r.getError()).isNull();
    }

    // ------------------------------------------------------------------
    // Write-once fields
    // ------------------------------------------------------------------

    @Test
    void pagesUrl_isWriteOnce() {
        TaskRecord r = newRecord();
        r.setPagesUrl("https://me.github.io/a/");
        r.setPagesUrl("https://me.github.io/a/");   // same value again is fine

        assertThatThrownBy(() -> r.setPagesUrl("https://me.github.io/b/"))
                .isInstanceOf(IllegalStateException.class);
        assertThat(r.getPagesUrl()).isEqualTo("https://me.github.io/a/");
    }

    @Test
    void repository_isWriteOnce() {
        TaskRecord r = newRecord();
        r.setRepository(new RepositoryHandle("me", "tds-demo", "https://github.com/me/tds-demo", "main"));

        assertThatThrownBy(() -> r.setRepository(
                new RepositoryHandle("me", "tds-demo-2", "https://github.com/me/tds-demo-2", "main")))
                .isInstanceOf(IllegalStateException.class);
        assertThat(r.getRepositoryUrl()).isEqualTo("https://github.com/me/tds-demo");
    }

    @Test
    void copy_isDetached() {
        TaskRecord r = newRecord();
        TaskRecord snapshot = r.copy();

        r.transitionTo(TaskState.GENERATING);
        r.addWarning(TaskError.of(ErrorKind.PUBLISH_DEGRADED, "pages off"));

        assertThat(snapshot.getState()).isEqualTo(TaskState.QUEUED);
        assertThat(snapshot.getWarnings()).isEmpty();
    }

    @Test
    void wireNames_areLowerCase() {
        assertThat(TaskState.NOTIFYING.wireName()).isEqualTo("notifying");
        assertThat(ErrorKind.REPOSITORY_UNAVAILABLE.wireName()).isEqualTo("RepositoryUnavailable");
        assertThat(ErrorKind.PUBLISH_DEGRADED.isFatal()).isFalse();
        assertThat(ErrorKind.REPOSITORY_NAME_EXHAUSTED.isFatal()).isTrue();
    }
}
