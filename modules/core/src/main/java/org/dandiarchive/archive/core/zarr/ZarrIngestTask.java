package org.dandiarchive.archive.core.zarr;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.task.ArchiveTask;
import org.dandiarchive.archive.core.task.TaskContext;
import org.dandiarchive.archive.core.task.TaskIO;
import org.dandiarchive.archive.core.task.TaskOutcome;
import org.jdbi.v3.core.ConnectionException;

import java.util.UUID;

/**
 * Input: zarr archive id. Output: true if the archive reached COMPLETE.
 * A run that still fails after its retries leaves the archive INGESTING; the sweep resubmits it.
 */
@ApplicationScoped
@TaskIO(input = UUID.class, output = Boolean.class, softTimeLimitSeconds = 600,
        retryOn = ConnectionException.class)
public class ZarrIngestTask implements ArchiveTask {

    public static final String TYPE = "zarr.ingest";

    private final ZarrArchiveService zarrService;

    @Inject
    public ZarrIngestTask(ZarrArchiveService zarrService) {
        this.zarrService = zarrService;
    }

    @Override
    public String taskType() {
        return TYPE;
    }

    @Override
    public TaskOutcome onStart(Object input, TaskContext ctx) {
        return TaskOutcome.complete(zarrService.ingest((UUID) input));
    }
}
