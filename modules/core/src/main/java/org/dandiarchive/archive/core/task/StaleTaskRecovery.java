package org.dandiarchive.archive.core.task;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Returns tasks whose claim lease expired (the worker crashed or was killed) to the queue.
 */
@ApplicationScoped
public class StaleTaskRecovery {

    private static final Logger log = Logger.getLogger(StaleTaskRecovery.class);

    private final TaskService taskService;
    private final Clock clock;
    private final Duration claimLease;

    @Inject
    public StaleTaskRecovery(TaskService taskService, Clock clock,
                             @ConfigProperty(name = "archive.tasks.claim-lease", defaultValue = "PT5M")
                             Duration claimLease) {
        this.taskService = taskService;
        this.clock = clock;
        this.claimLease = claimLease;
    }

    @Scheduled(every = "30s", concurrentExecution = SKIP)
    public void sweep() {
        recoverExpiredLeases();
    }

    List<TaskRecord> recoverExpiredLeases() {
        Instant cutoff = clock.instant().minus(claimLease);
        List<TaskRecord> recovered = taskService.requeueStale(cutoff);
        for (TaskRecord task : recovered) {
            log.warnf("Task %d (type=%s) lease expired, returned to OPEN (retry #%d)",
                    task.id(), task.type(), task.retryCount() + 1);
        }
        return recovered;
    }
}
