package org.dandiarchive.archive.core.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.dao.TaskDao;
import org.dandiarchive.archive.core.task.TaskStatus;
import org.dandiarchive.archive.core.task.TaskWorkerPool;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;
import org.jdbi.v3.core.Jdbi;

/**
 * Ready while the database answers. Reports queue depth, tasks abandoned as DEAD and live workers.
 */
@Readiness
@ApplicationScoped
public class TaskQueueHealthCheck implements HealthCheck {

    @Inject
    Jdbi jdbi;

    @Inject
    TaskWorkerPool workerPool;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("task-queue");
        try {
            jdbi.useExtension(TaskDao.class, dao -> builder
                    .withData("open", dao.countByStatus(TaskStatus.OPEN))
                    .withData("inProgress", dao.countByStatus(TaskStatus.IN_PROGRESS))
                    .withData("dead", dao.countByStatus(TaskStatus.DEAD)));
            builder.up();
        } catch (RuntimeException e) {
            builder.down().withData("error", String.valueOf(e.getMessage()));
        }
        return builder
                .withData("workersRunning", workerPool.isRunning())
                .withData("liveWorkers", workerPool.liveWorkers())
                .build();
    }
}
