package org.dandiarchive.archive.core.task;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

/**
 * One row of the task queue. {@code input} and {@code output} hold JSON; after a failure
 * {@code output} carries the serialized {@link TaskError}.
 */
public record TaskRecord(
        @ColumnName("id") int id,
        @ColumnName("type") String type,
        @ColumnName("status") TaskStatus status,
        @ColumnName("priority") int priority,
        @ColumnName("input") String input,
        @ColumnName("output") String output,
        @ColumnName("retryable") Boolean retryable,
        @ColumnName("retry_count") int retryCount,
        @ColumnName("executor") String executor,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("claimed_at") Instant claimedAt,
        @ColumnName("completed_at") Instant completedAt,
        @ColumnName("not_before") Instant notBefore
) {

    /** Queued again after a failed run and held back until {@code notBefore}. */
    public boolean awaitingRetry(Instant now) {
        return status == TaskStatus.OPEN && notBefore != null && notBefore.isAfter(now);
    }
}
