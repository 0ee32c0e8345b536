package org.dandiarchive.archive.core.task;

/**
 * Result of one run of an {@link ArchiveTask}. A completed output becomes the task's JSON output;
 * a failure is retried or recorded according to {@link TaskError#retryable()}.
 */
public sealed interface TaskOutcome {

    record Complete(Object output) implements TaskOutcome {}

    record Failed(TaskError error) implements TaskOutcome {}

    static TaskOutcome complete(Object output) {
        return new Complete(output);
    }

    /** Completes with the name of the validation or upload state the run settled on. */
    static TaskOutcome settled(Enum<?> state) {
        return new Complete(state.name());
    }

    static TaskOutcome fail(TaskError error) {
        return new Failed(error);
    }
}
