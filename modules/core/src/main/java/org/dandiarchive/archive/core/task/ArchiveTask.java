package org.dandiarchive.archive.core.task;

/**
 * A unit of background work that is queued in the {@code task} table and
 * executed by a {@link TaskWorkerPool} thread.
 * <p>
 * Implementations must be {@code @ApplicationScoped} CDI beans annotated with
 * {@link TaskIO}. Runs must be idempotent: a task may execute more than once.
 */
public interface ArchiveTask {

    String taskType();

    TaskOutcome onStart(Object input, TaskContext ctx);
}
