package org.dandiarchive.archive.core.task;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.config.ArchiveSettings;
import org.dandiarchive.archive.core.dao.TaskDao;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Queue operations over the {@code task} table: submission, claiming and release.
 */
@ApplicationScoped
public class TaskService {

    private static final Logger log = Logger.getLogger(TaskService.class);

    public static final int DEFAULT_PRIORITY = 128;
    private static final int CLAIM_CANDIDATES = 8;

    private final Jdbi jdbi;
    private final ObjectMapper objectMapper;
    private final ArchiveSettings settings;
    private final Clock clock;

    @Inject
    public TaskService(Jdbi jdbi, ObjectMapper objectMapper, ArchiveSettings settings, Clock clock) {
        this.jdbi = jdbi;
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.clock = clock;
    }

    public int submit(String taskType, Object input) {
        return submit(taskType, input, DEFAULT_PRIORITY);
    }

    public int submit(String taskType, Object input, int priority) {
        String inputJson = serialize(input);
        int id = jdbi.withExtension(TaskDao.class, dao ->
                dao.insert(taskType, TaskStatus.OPEN, priority, inputJson, clock.instant()));
        log.debugf("Task submitted: id=%d, type=%s", id, taskType);
        return id;
    }

    /**
     * Submits unless an identical task (same type and input) is still waiting in the
     * queue. A waiting task has not read any state yet, so a second copy adds nothing.
     * <p>
     * The check is best effort: two callers racing past it each insert a row. Every
     * archive task is idempotent, so the duplicate only costs a redundant run.
     *
     * @return true if a new task row was created
     */
    public boolean submitUnique(String taskType, Object input) {
        String inputJson = serialize(input);
        Integer created = jdbi.inTransaction(handle -> {
            TaskDao dao = handle.attach(TaskDao.class);
            if (dao.countMatching(taskType, inputJson, TaskStatus.OPEN) > 0) {
                return null;
            }
            return dao.insert(taskType, TaskStatus.OPEN, DEFAULT_PRIORITY, inputJson, clock.instant());
        });
        if (created == null) {
            log.tracef("Task %s(%s) already queued", taskType, inputJson);
            return false;
        }
        log.debugf("Task submitted: id=%d, type=%s", created, taskType);
        return true;
    }

    /** True while a task of this type and input is waiting or running. */
    public boolean isActive(String taskType, Object input) {
        String inputJson = serialize(input);
        return jdbi.withExtension(TaskDao.class, dao ->
                dao.countMatching(taskType, inputJson, TaskStatus.OPEN) > 0
                        || dao.countMatching(taskType, inputJson, TaskStatus.IN_PROGRESS) > 0);
    }

    public Optional<TaskRecord> get(int taskId) {
        return jdbi.withExtension(TaskDao.class, dao -> dao.findById(taskId));
    }

    public List<TaskRecord> findByStatus(TaskStatus status) {
        return jdbi.withExtension(TaskDao.class, dao -> dao.findByStatus(status));
    }

    public List<TaskRecord> findByType(String taskType) {
        return jdbi.withExtension(TaskDao.class, dao -> dao.findByType(taskType));
    }

    // -- Package-private methods for TaskExecutor and StaleTaskRecovery --

    /**
     * Claims the next eligible task. Several workers may race for the same row;
     * the compare-and-set claim lets exactly one of them win.
     */
    Optional<TaskRecord> claimNext(String executor) {
        Instant now = clock.instant();
        return jdbi.withExtension(TaskDao.class, dao -> {
            for (int id : dao.findClaimable(TaskStatus.OPEN, now, CLAIM_CANDIDATES)) {
                if (dao.claim(id, executor, now, TaskStatus.OPEN, TaskStatus.IN_PROGRESS) == 1) {
                    return dao.findById(id);
                }
            }
            return Optional.empty();
        });
    }

    void release(TaskRecord record, TaskOutcome outcome) {
        int taskId = record.id();
        Instant now = clock.instant();
        if (outcome instanceof TaskOutcome.Complete c) {
            String outputJson = serialize(c.output());
            jdbi.useExtension(TaskDao.class, dao ->
                    dao.complete(taskId, TaskStatus.COMPLETE, outputJson, now));
            log.debugf("Task %d (type=%s) complete", taskId, record.type());
        } else if (outcome instanceof TaskOutcome.Failed f) {
            TaskError error = f.error();
            String errorJson = serialize(error);
            if (error.retryable() && record.retryCount() < settings.maxTaskRetries()) {
                int attempt = record.retryCount() + 1;
                Instant notBefore = now.plus(settings.retryDelay(attempt));
                jdbi.useExtension(TaskDao.class, dao -> dao.returnToOpen(
                        taskId, TaskStatus.IN_PROGRESS, TaskStatus.OPEN, notBefore, errorJson));
                log.warnf("Task %d (type=%s) failed, retry #%d not before %s: %s",
                        taskId, record.type(), attempt, notBefore, error.message());
            } else {
                jdbi.useExtension(TaskDao.class, dao ->
                        dao.failTerminal(taskId, TaskStatus.ERROR, errorJson, error.retryable(), now));
                if (error.retryable()) {
                    log.errorf("Task %d (type=%s) exhausted %d retries: %s",
                            taskId, record.type(), settings.maxTaskRetries(), error.message());
                } else {
                    log.errorf("Task %d (type=%s) failed: %s", taskId, record.type(), error.message());
                }
            }
        }
    }

    /** Marks a run that overran its soft time limit as abandoned. */
    void abandon(TaskRecord record, String reason) {
        String errorJson = serialize(new TaskError(reason, null, null, false));
        jdbi.useExtension(TaskDao.class, dao ->
                dao.failTerminal(record.id(), TaskStatus.DEAD, errorJson, false, clock.instant()));
    }

    /** Returns in-progress tasks claimed before {@code cutoff} to the queue. */
    List<TaskRecord> requeueStale(Instant cutoff) {
        return jdbi.withExtension(TaskDao.class, dao -> {
            List<TaskRecord> stale = dao.findStaleInProgress(TaskStatus.IN_PROGRESS, cutoff);
            return stale.stream()
                    .filter(t -> dao.returnToOpen(t.id(), TaskStatus.IN_PROGRESS, TaskStatus.OPEN,
                            null, t.output()) == 1)
                    .toList();
        });
    }

    <T> T deserializeInput(TaskRecord record, Class<T> inputType) {
        if (record.input() == null) {
            return null;
        }
        try {
            return objectMapper.readValue(record.input(), inputType);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to deserialize input for task " + record.id(), e);
        }
    }

    private String serialize(Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to serialize: " + value, e);
        }
    }
}
