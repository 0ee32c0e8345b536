package org.dandiarchive.archive.core.task;

/**
 * Queue state of a task row, persisted as a SMALLINT code.
 */
public enum TaskStatus {
    OPEN(0),
    IN_PROGRESS(1),
    COMPLETE(2),
    /** Failed permanently, or retryable but out of retries. */
    ERROR(3),
    /** Abandoned after exceeding its soft time limit. */
    DEAD(4);

    private static final TaskStatus[] BY_CODE = values();

    private final int id;

    TaskStatus(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    /** No worker will touch the task again. */
    public boolean isTerminal() {
        return id >= COMPLETE.id;
    }

    public static TaskStatus fromId(int id) {
        if (id < 0 || id >= BY_CODE.length) {
            throw new IllegalArgumentException("Unknown task status code: " + id);
        }
        return BY_CODE[id];
    }
}
