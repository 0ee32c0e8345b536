package org.dandiarchive.archive.core.task;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.dao.TaskDao;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Worker threads draining the archive task queue through {@link TaskExecutor}.
 * Starts once the database answers, so validation and digest tasks never run against a missing schema.
 * A worker count of zero leaves the queue to other nodes.
 */
@ApplicationScoped
public class TaskWorkerPool {

    private static final Logger log = Logger.getLogger(TaskWorkerPool.class);

    @Inject
    TaskExecutor taskExecutor;

    @Inject
    Jdbi jdbi;

    @ConfigProperty(name = "archive.tasks.worker-count", defaultValue = "4")
    int workerCount;

    @ConfigProperty(name = "archive.tasks.poll-interval-ms", defaultValue = "1000")
    long pollIntervalMs;

    private final List<Thread> workers = new CopyOnWriteArrayList<>();
    private volatile boolean running;

    void onStart(@Observes StartupEvent event) {
        if (workerCount <= 0) {
            log.info("Task workers disabled on this node");
            return;
        }
        // Fails fast when the task table is missing
        int queued = jdbi.withExtension(TaskDao.class, dao -> dao.countByStatus(TaskStatus.OPEN));
        log.infof("%d tasks waiting in the queue", queued);
        running = true;
        for (int i = 0; i < workerCount; i++) {
            Thread worker = new Thread(this::drain, "archive-task-" + i);
            worker.setDaemon(true);
            worker.start();
            workers.add(worker);
        }
        log.infof("Started %d task workers polling every %dms", workerCount, pollIntervalMs);
    }

    void onStop(@Observes ShutdownEvent event) {
        running = false;
        List<Thread> stopping = new ArrayList<>(workers);
        workers.clear();
        stopping.forEach(Thread::interrupt);
        if (!stopping.isEmpty()) {
            log.infof("Stopped %d task workers", stopping.size());
        }
    }

    public boolean isRunning() {
        return running;
    }

    public long liveWorkers() {
        return workers.stream().filter(Thread::isAlive).count();
    }

    private void drain() {
        while (running) {
            try {
                if (!taskExecutor.runNext()) {
                    Thread.sleep(pollIntervalMs);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                // Database outages surface here; back off for one poll interval and try again
                log.error("Task worker failed to claim or record a task", e);
                try {
                    Thread.sleep(pollIntervalMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }
}
