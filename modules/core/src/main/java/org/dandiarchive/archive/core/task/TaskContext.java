package org.dandiarchive.archive.core.task;

/**
 * What a running task knows about its queue entry.
 */
public interface TaskContext {

    int taskId();

    String taskType();

    /** Zero on the first run, incremented on every retry and every lease recovery. */
    int attempt();

    default boolean isRetry() {
        return attempt() > 0;
    }
}
