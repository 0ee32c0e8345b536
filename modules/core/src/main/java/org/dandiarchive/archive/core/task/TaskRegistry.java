package org.dandiarchive.archive.core.task;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Task types known to this node, keyed by {@link ArchiveTask#taskType()}.
 * Rejects handlers without a {@link TaskIO} declaration and types claimed twice.
 */
@ApplicationScoped
public class TaskRegistry {

    private static final Logger log = Logger.getLogger(TaskRegistry.class);

    private final Map<String, ArchiveTask> handlers = new TreeMap<>();

    @Inject
    public TaskRegistry(Instance<ArchiveTask> tasks) {
        this((Iterable<ArchiveTask>) tasks);
    }

    public TaskRegistry(Iterable<? extends ArchiveTask> tasks) {
        for (ArchiveTask task : tasks) {
            String type = task.taskType();
            TaskIO io = task.getClass().getAnnotation(TaskIO.class);
            if (io == null) {
                throw new IllegalStateException(task.getClass().getName() + " (" + type + ") has no @TaskIO");
            }
            if (io.softTimeLimitSeconds() <= 0) {
                throw new IllegalStateException("Task type '" + type + "' needs a positive soft time limit");
            }
            ArchiveTask previous = handlers.putIfAbsent(type, task);
            if (previous != null) {
                throw new IllegalStateException("Task type '" + type + "' claimed by both "
                        + previous.getClass().getSimpleName() + " and " + task.getClass().getSimpleName());
            }
        }
        log.infof("Task types: %s", handlers.keySet());
    }

    public Optional<ArchiveTask> lookup(String taskType) {
        return Optional.ofNullable(handlers.get(taskType));
    }

    public Set<String> types() {
        return handlers.keySet();
    }
}
