package org.dandiarchive.archive.core.blob;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.storage.StorageException;
import org.dandiarchive.archive.core.task.ArchiveTask;
import org.dandiarchive.archive.core.task.TaskContext;
import org.dandiarchive.archive.core.task.TaskIO;
import org.dandiarchive.archive.core.task.TaskOutcome;

/**
 * Input: blob row id. Output: the SHA-256 hex digest.
 */
@ApplicationScoped
@TaskIO(input = Long.class, output = String.class, softTimeLimitSeconds = 3600,
        retryOn = StorageException.class)
public class CalculateSha256Task implements ArchiveTask {

    public static final String TYPE = "blob.calculate-sha256";

    private final AssetBlobService blobService;

    @Inject
    public CalculateSha256Task(AssetBlobService blobService) {
        this.blobService = blobService;
    }

    @Override
    public String taskType() {
        return TYPE;
    }

    @Override
    public TaskOutcome onStart(Object input, TaskContext ctx) {
        return TaskOutcome.complete(blobService.calculateSha256((Long) input));
    }
}
