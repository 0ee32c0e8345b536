package org.dandiarchive.archive.core.manifest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.storage.StorageException;
import org.dandiarchive.archive.core.task.ArchiveTask;
import org.dandiarchive.archive.core.task.TaskContext;
import org.dandiarchive.archive.core.task.TaskIO;
import org.dandiarchive.archive.core.task.TaskOutcome;

/**
 * Input: version row id. Output: storage prefix of the written manifests.
 */
@ApplicationScoped
@TaskIO(input = Long.class, output = String.class, softTimeLimitSeconds = 300,
        retryOn = StorageException.class)
public class WriteManifestTask implements ArchiveTask {

    public static final String TYPE = "manifest.write";

    private final ManifestWriter manifestWriter;

    @Inject
    public WriteManifestTask(ManifestWriter manifestWriter) {
        this.manifestWriter = manifestWriter;
    }

    @Override
    public String taskType() {
        return TYPE;
    }

    @Override
    public TaskOutcome onStart(Object input, TaskContext ctx) {
        return TaskOutcome.complete(manifestWriter.writeManifests((Long) input));
    }
}
