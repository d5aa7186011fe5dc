package com.searchnexus.service;

import com.searchnexus.config.NexusProperties;
import com.searchnexus.exception.NexusErrorCode;
import com.searchnexus.exception.NexusException;
import com.searchnexus.model.LifecycleAction;
import com.searchnexus.model.LifecycleTask;
import com.searchnexus.model.ReconcileOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LifecycleTaskServiceTest {

    private NexusProperties properties;
    private LifecycleTaskService tasks;

    @BeforeEach
    void setUp() {
        properties = new NexusProperties();
        tasks = new LifecycleTaskService(properties);
    }

    @Test
    void newTaskIsAccepted() {
        LifecycleTask task = tasks.create("node-1", LifecycleAction.START, "s-1", 20);

        assertThat(task.getTaskId()).isNotBlank();
        assertThat(task.getStatus()).isEqualTo("accepted");
        assertThat(task.getMaxAttempts()).isEqualTo(20);
        assertThat(task.isFinished()).isFalse();
    }

    @Test
    void progressThenComplete() {
        LifecycleTask task = tasks.create("node-1", LifecycleAction.STOP, null, 10);

        tasks.progress(task.getTaskId(), 3);
        assertThat(tasks.get(task.getTaskId()).getStatus()).isEqualTo("polling");
        assertThat(tasks.get(task.getTaskId()).getAttempt()).isEqualTo(3);

        tasks.complete(task.getTaskId(), ReconcileOutcome.TIMED_OUT, "N-504", "gave up");
        LifecycleTask done = tasks.get(task.getTaskId());
        assertThat(done.getStatus()).isEqualTo("timed_out");
        assertThat(done.getErrorCode()).isEqualTo("N-504");
        assertThat(done.getEndTime()).isNotNull();
    }

    @Test
    void firstOutcomeWins() {
        LifecycleTask task = tasks.create("node-1", LifecycleAction.START, null, 10);

        tasks.complete(task.getTaskId(), ReconcileOutcome.CONVERGED, null, "running");
        tasks.complete(task.getTaskId(), ReconcileOutcome.CANCELLED, null, "late cancel");
        tasks.progress(task.getTaskId(), 9);

        LifecycleTask done = tasks.get(task.getTaskId());
        assertThat(done.getOutcome()).isEqualTo(ReconcileOutcome.CONVERGED);
        assertThat(done.getStatus()).isEqualTo("completed");
        assertThat(done.getAttempt()).isZero();
    }

    @Test
    void returnedTasksAreSnapshots() {
        LifecycleTask task = tasks.create("node-1", LifecycleAction.START, null, 10);
        task.setStatus("tampered");

        assertThat(tasks.get(task.getTaskId()).getStatus()).isEqualTo("accepted");
    }

    @Test
    void finishedTasksExpire() throws InterruptedException {
        properties.getReconcile().setTaskRetention(Duration.ofMillis(10));
        LifecycleTask task = tasks.create("node-1", LifecycleAction.START, null, 10);
        tasks.complete(task.getTaskId(), ReconcileOutcome.CONVERGED, null, "running");

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        boolean gone = false;
        while (!gone && System.nanoTime() < deadline) {
            try {
                tasks.get(task.getTaskId());
                Thread.sleep(10);
            } catch (NexusException e) {
                gone = true;
            }
        }
        assertThat(gone).isTrue();
    }

    @Test
    void unknownTaskIsNotFound() {
        assertThatThrownBy(() -> tasks.get("missing"))
                .isInstanceOfSatisfying(NexusException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(NexusErrorCode.TASK_NOT_FOUND));
    }
}
