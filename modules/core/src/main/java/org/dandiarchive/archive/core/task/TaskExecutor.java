package org.dandiarchive.archive.core.task;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.lang.management.ManagementFactory;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Claims and runs one task at a time on behalf of a worker thread.
 * <p>
 * Each run happens on a separate thread so the caller can enforce the task
 * type's soft time limit; an overrunning run is interrupted and the task is
 * marked {@link TaskStatus#DEAD}. Periodic sweeps re-enumerate pending records,
 * so abandoned work is picked up again.
 */
@ApplicationScoped
public class TaskExecutor {

    private static final Logger log = Logger.getLogger(TaskExecutor.class);

    private final TaskService taskService;
    private final TaskRegistry taskRegistry;
    private final String nodeName = ManagementFactory.getRuntimeMXBean().getName();
    private final ExecutorService runner = Executors.newCachedThreadPool(new RunnerThreadFactory());

    @Inject
    public TaskExecutor(TaskService taskService, TaskRegistry taskRegistry) {
        this.taskService = taskService;
        this.taskRegistry = taskRegistry;
    }

    /**
     * Claims and executes the next eligible task.
     *
     * @return false if the queue had nothing to claim
     */
    public boolean runNext() {
        Optional<TaskRecord> claimed = taskService.claimNext(nodeName + "/" + Thread.currentThread().getName());
        if (claimed.isEmpty()) {
            return false;
        }
        execute(claimed.get());
        return true;
    }

    /**
     * Runs tasks until none are eligible. Tasks deferred by retry backoff are left queued.
     *
     * @return number of tasks executed
     */
    public int drain() {
        int count = 0;
        while (runNext()) {
            count++;
        }
        return count;
    }

    private void execute(TaskRecord record) {
        Optional<ArchiveTask> optTask = taskRegistry.lookup(record.type());
        if (optTask.isEmpty()) {
            log.errorf("No handler for task type '%s' (task %d)", record.type(), record.id());
            taskService.release(record, TaskOutcome.fail(new TaskError(
                    "No handler for task type: " + record.type(), null, null, false)));
            return;
        }

        ArchiveTask task = optTask.get();
        TaskIO io = task.getClass().getAnnotation(TaskIO.class);
        TaskContext ctx = DefaultTaskContext.of(record);

        TaskOutcome outcome;
        Future<TaskOutcome> run = null;
        try {
            Object input = taskService.deserializeInput(record, io.input());
            run = runner.submit(() -> task.onStart(input, ctx));
            outcome = run.get(io.softTimeLimitSeconds(), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            run.cancel(true);
            log.warnf("Task %d (type=%s) exceeded its %ds soft time limit; abandoned",
                    record.id(), record.type(), io.softTimeLimitSeconds());
            taskService.abandon(record, "Soft time limit of " + io.softTimeLimitSeconds() + "s exceeded");
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (run != null) {
                run.cancel(true);
            }
            taskService.abandon(record, "Worker interrupted");
            return;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.debugf(cause, "Task %d (type=%s) threw exception", record.id(), record.type());
            outcome = TaskOutcome.fail(TaskError.from(cause, io.retryOn()));
        } catch (RuntimeException e) {
            log.errorf(e, "Task %d (type=%s) could not be started", record.id(), record.type());
            outcome = TaskOutcome.fail(TaskError.from(e, io.retryOn()));
        }

        taskService.release(record, outcome);
    }

    @PreDestroy
    void shutdown() {
        runner.shutdownNow();
    }

    private static final class RunnerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "task-run-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
