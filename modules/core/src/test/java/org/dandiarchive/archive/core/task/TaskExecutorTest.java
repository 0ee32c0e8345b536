package org.dandiarchive.archive.core.task;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dandiarchive.archive.core.testing.MutableClock;
import org.dandiarchive.archive.core.testing.TestArchive;
import org.dandiarchive.archive.core.testing.TestDatabase;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class TaskExecutorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private TaskService taskService;
    private FlakyTask flaky;
    private TaskExecutor executor;

    @BeforeEach
    void setUp() {
        Jdbi jdbi = TestDatabase.create();
        taskService = new TaskService(jdbi, new ObjectMapper(), TestArchive.settings(), clock);
        flaky = new FlakyTask();
        executor = new TaskExecutor(taskService, new TaskRegistry(List.of(new EchoTask(), flaky, new SlowTask())));
    }

    @Test
    void completedTaskStoresItsOutput() {
        int id = taskService.submit(EchoTask.TYPE, "hello");

        assertThat(executor.runNext()).isTrue();

        TaskRecord done = taskService.get(id).orElseThrow();
        assertThat(done.status()).isEqualTo(TaskStatus.COMPLETE);
        assertThat(done.output()).isEqualTo("\"HELLO\"");
        assertThat(done.completedAt()).isEqualTo(clock.instant());
        assertThat(executor.runNext()).isFalse();
    }

    @Test
    void higherPriorityRunsFirst() {
        int low = taskService.submit(EchoTask.TYPE, "low", 1);
        int high = taskService.submit(EchoTask.TYPE, "high", 200);

        executor.runNext();

        assertThat(taskService.get(high).orElseThrow().status()).isEqualTo(TaskStatus.COMPLETE);
        assertThat(taskService.get(low).orElseThrow().status()).isEqualTo(TaskStatus.OPEN);
    }

    @Test
    void submitUniqueSkipsAnIdenticalQueuedTask() {
        assertThat(taskService.submitUnique(EchoTask.TYPE, "same")).isTrue();
        assertThat(taskService.submitUnique(EchoTask.TYPE, "same")).isFalse();
        assertThat(taskService.submitUnique(EchoTask.TYPE, "other")).isTrue();

        executor.drain();

        assertThat(taskService.submitUnique(EchoTask.TYPE, "same")).isTrue();
    }

    @Test
    void taskStaysActiveUntilReleased() {
        assertThat(taskService.isActive(EchoTask.TYPE, "busy")).isFalse();
        taskService.submitUnique(EchoTask.TYPE, "busy");
        assertThat(taskService.isActive(EchoTask.TYPE, "busy")).isTrue();

        TaskRecord running = taskService.claimNext("test-node").orElseThrow();
        assertThat(taskService.isActive(EchoTask.TYPE, "busy")).isTrue();
        // a running copy has already read its state, so a new one is queued
        assertThat(taskService.submitUnique(EchoTask.TYPE, "busy")).isTrue();

        taskService.release(running, TaskOutcome.complete("BUSY"));
        executor.drain();

        assertThat(taskService.isActive(EchoTask.TYPE, "busy")).isFalse();
    }

    @Test
    void retryableFailureBacksOffExponentially() {
        flaky.failuresLeft.set(2);
        int id = taskService.submit(FlakyTask.TYPE, "x");

        executor.drain();
        TaskRecord first = taskService.get(id).orElseThrow();
        assertThat(first.status()).isEqualTo(TaskStatus.OPEN);
        assertThat(first.retryCount()).isEqualTo(1);
        assertThat(first.notBefore()).isEqualTo(clock.instant().plusSeconds(1));
        assertThat(executor.runNext()).isFalse();

        clock.advance(Duration.ofSeconds(1));
        executor.drain();
        TaskRecord second = taskService.get(id).orElseThrow();
        assertThat(second.retryCount()).isEqualTo(2);
        assertThat(second.notBefore()).isEqualTo(clock.instant().plusSeconds(2));

        clock.advance(Duration.ofSeconds(2));
        executor.drain();
        assertThat(taskService.get(id).orElseThrow().status()).isEqualTo(TaskStatus.COMPLETE);
        assertThat(flaky.attempts).containsExactly(0, 1, 2);
    }

    @Test
    void retryBudgetIsBounded() {
        flaky.failuresLeft.set(Integer.MAX_VALUE);
        int id = taskService.submit(FlakyTask.TYPE, "x");

        for (int i = 0; i < 10; i++) {
            executor.drain();
            clock.advance(Duration.ofMinutes(1));
        }

        TaskRecord failed = taskService.get(id).orElseThrow();
        assertThat(failed.status()).isEqualTo(TaskStatus.ERROR);
        assertThat(failed.retryable()).isTrue();
        assertThat(failed.retryCount()).isEqualTo(TestArchive.settings().maxTaskRetries());
    }

    @Test
    void nonRetryableFailureIsTerminal() {
        int id = taskService.submit(EchoTask.TYPE, null);

        executor.drain();

        TaskRecord failed = taskService.get(id).orElseThrow();
        assertThat(failed.status()).isEqualTo(TaskStatus.ERROR);
        assertThat(failed.retryable()).isFalse();
        assertThat(failed.output()).contains("NullPointerException");
    }

    @Test
    void unknownTypeFails() {
        int id = taskService.submit("no.such.type", "x");

        executor.drain();

        assertThat(taskService.get(id).orElseThrow().status()).isEqualTo(TaskStatus.ERROR);
    }

    @Test
    void overrunningTaskIsAbandoned() {
        int id = taskService.submit(SlowTask.TYPE, 5_000L);

        executor.drain();

        TaskRecord dead = taskService.get(id).orElseThrow();
        assertThat(dead.status()).isEqualTo(TaskStatus.DEAD);
        assertThat(dead.output()).contains("Soft time limit");
    }

    @Test
    void expiredLeaseReturnsTaskToQueue() {
        int id = taskService.submit(EchoTask.TYPE, "lost");
        assertThat(taskService.claimNext("crashed-worker")).isPresent();
        StaleTaskRecovery recovery = new StaleTaskRecovery(taskService, clock, Duration.ofMinutes(5));

        assertThat(recovery.recoverExpiredLeases()).isEmpty();
        clock.advance(Duration.ofMinutes(6));
        assertThat(recovery.recoverExpiredLeases()).extracting(TaskRecord::id).containsExactly(id);

        executor.drain();
        TaskRecord done = taskService.get(id).orElseThrow();
        assertThat(done.status()).isEqualTo(TaskStatus.COMPLETE);
        assertThat(done.retryCount()).isEqualTo(1);
    }

    @Test
    void registryRejectsDuplicateTypes() {
        assertThatIllegalStateException()
                .isThrownBy(() -> new TaskRegistry(List.of(new EchoTask(), new EchoTask())))
                .withMessageContaining(EchoTask.TYPE);
    }

    @Test
    void registryListsTypesInNameOrder() {
        TaskRegistry registry = new TaskRegistry(List.of(new SlowTask(), new EchoTask(), new FlakyTask()));

        assertThat(registry.types()).containsExactly(EchoTask.TYPE, FlakyTask.TYPE, SlowTask.TYPE);
    }

    @Test
    void registryRejectsTasksWithoutSoftTimeLimit() {
        assertThatIllegalStateException()
                .isThrownBy(() -> new TaskRegistry(List.of(new UnboundedTask())))
                .withMessageContaining(UnboundedTask.TYPE);
    }

    @TaskIO(input = String.class, output = String.class)
    static class EchoTask implements ArchiveTask {
        static final String TYPE = "test.echo";

        @Override
        public String taskType() {
            return TYPE;
        }

        @Override
        public TaskOutcome onStart(Object input, TaskContext ctx) {
            return TaskOutcome.complete(((String) input).toUpperCase());
        }
    }

    @TaskIO(input = String.class, output = String.class, retryOn = IllegalStateException.class)
    static class FlakyTask implements ArchiveTask {
        static final String TYPE = "test.flaky";

        final AtomicInteger failuresLeft = new AtomicInteger();
        final List<Integer> attempts = new java.util.concurrent.CopyOnWriteArrayList<>();

        @Override
        public String taskType() {
            return TYPE;
        }

        @Override
        public TaskOutcome onStart(Object input, TaskContext ctx) {
            attempts.add(ctx.attempt());
            if (failuresLeft.getAndDecrement() > 0) {
                throw new IllegalStateException("transient failure");
            }
            return TaskOutcome.complete("ok");
        }
    }

    @TaskIO(input = Long.class, output = String.class, softTimeLimitSeconds = 1)
    static class SlowTask implements ArchiveTask {
        static final String TYPE = "test.slow";

        @Override
        public String taskType() {
            return TYPE;
        }

        @Override
        public TaskOutcome onStart(Object input, TaskContext ctx) {
            try {
                Thread.sleep((Long) input);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return TaskOutcome.complete("late");
        }
    }

    @TaskIO(input = String.class, output = String.class, softTimeLimitSeconds = 0)
    static class UnboundedTask implements ArchiveTask {
        static final String TYPE = "test.unbounded";

        @Override
        public String taskType() {
            return TYPE;
        }

        @Override
        public TaskOutcome onStart(Object input, TaskContext ctx) {
            return TaskOutcome.complete(input);
        }
    }
}
