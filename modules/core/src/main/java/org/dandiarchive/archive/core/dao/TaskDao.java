package org.dandiarchive.archive.core.dao;

import org.dandiarchive.archive.core.task.TaskRecord;
import org.dandiarchive.archive.core.task.TaskStatus;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(TaskRecord.class)
public interface TaskDao {

    @SqlUpdate("INSERT INTO task (type, status, priority, input, created_at) " +
            "VALUES (:type, :status, :priority, :input, :now)")
    @GetGeneratedKeys("id")
    int insert(@Bind("type") String type,
               @Bind("status") TaskStatus status,
               @Bind("priority") int priority,
               @Bind("input") String input,
               @Bind("now") Instant now);

    @SqlQuery("SELECT * FROM task WHERE id = :id")
    Optional<TaskRecord> findById(@Bind("id") int id);

    @SqlQuery("SELECT * FROM task WHERE status = :status ORDER BY id")
    List<TaskRecord> findByStatus(@Bind("status") TaskStatus status);

    @SqlQuery("SELECT * FROM task WHERE type = :type ORDER BY id")
    List<TaskRecord> findByType(@Bind("type") String type);

    @SqlQuery("SELECT COUNT(*) FROM task WHERE type = :type AND input = :input AND status = :status")
    int countMatching(@Bind("type") String type,
                      @Bind("input") String input,
                      @Bind("status") TaskStatus status);

    @SqlQuery("SELECT COUNT(*) FROM task WHERE status = :status")
    int countByStatus(@Bind("status") TaskStatus status);

    /** Candidate ids for claiming, highest priority first. Eligibility is rechecked by {@link #claim}. */
    @SqlQuery("SELECT id FROM task WHERE status = :status " +
            "AND (not_before IS NULL OR not_before <= :now) " +
            "ORDER BY priority DESC, id LIMIT :limit")
    List<Integer> findClaimable(@Bind("status") TaskStatus status,
                                @Bind("now") Instant now,
                                @Bind("limit") int limit);

    /** Compare-and-set claim; returns 1 if this caller won the task. */
    @SqlUpdate("UPDATE task SET status = :inProgress, executor = :executor, claimed_at = :now " +
            "WHERE id = :id AND status = :open")
    int claim(@Bind("id") int id,
              @Bind("executor") String executor,
              @Bind("now") Instant now,
              @Bind("open") TaskStatus open,
              @Bind("inProgress") TaskStatus inProgress);

    @SqlUpdate("UPDATE task SET status = :status, output = :output, completed_at = :now WHERE id = :id")
    void complete(@Bind("id") int id,
                  @Bind("status") TaskStatus status,
                  @Bind("output") String output,
                  @Bind("now") Instant now);

    @SqlUpdate("UPDATE task SET status = :status, output = :errorJson, retryable = :retryable, " +
            "completed_at = :now WHERE id = :id")
    void failTerminal(@Bind("id") int id,
                      @Bind("status") TaskStatus status,
                      @Bind("errorJson") String errorJson,
                      @Bind("retryable") Boolean retryable,
                      @Bind("now") Instant now);

    /** Puts a claimed task back in the queue, not to be claimed before {@code notBefore}. */
    @SqlUpdate("UPDATE task SET status = :open, executor = NULL, claimed_at = NULL, " +
            "retry_count = retry_count + 1, not_before = :notBefore, output = :errorJson " +
            "WHERE id = :id AND status = :expected")
    int returnToOpen(@Bind("id") int id,
                     @Bind("expected") TaskStatus expected,
                     @Bind("open") TaskStatus open,
                     @Bind("notBefore") Instant notBefore,
                     @Bind("errorJson") String errorJson);

    @SqlQuery("SELECT * FROM task WHERE status = :status AND claimed_at < :cutoff ORDER BY id")
    List<TaskRecord> findStaleInProgress(@Bind("status") TaskStatus status,
                                         @Bind("cutoff") Instant cutoff);
}
