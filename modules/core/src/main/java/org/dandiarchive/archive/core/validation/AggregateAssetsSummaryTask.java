package org.dandiarchive.archive.core.validation;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.error.VersionMetadataConcurrentlyModifiedException;
import org.dandiarchive.archive.core.task.ArchiveTask;
import org.dandiarchive.archive.core.task.TaskContext;
import org.dandiarchive.archive.core.task.TaskIO;
import org.dandiarchive.archive.core.task.TaskOutcome;
import org.jboss.logging.Logger;

/**
 * Input: version row id. Output: true if the version metadata was rewritten.
 * A concurrent change to the version makes the run fail and retry with backoff.
 */
@ApplicationScoped
@TaskIO(input = Long.class, output = Boolean.class, softTimeLimitSeconds = 60,
        retryOn = VersionMetadataConcurrentlyModifiedException.class)
public class AggregateAssetsSummaryTask implements ArchiveTask {

    private static final Logger log = Logger.getLogger(AggregateAssetsSummaryTask.class);

    public static final String TYPE = "aggregate.assets-summary";

    private final MetadataValidationService validationService;

    @Inject
    public AggregateAssetsSummaryTask(MetadataValidationService validationService) {
        this.validationService = validationService;
    }

    @Override
    public String taskType() {
        return TYPE;
    }

    @Override
    public TaskOutcome onStart(Object input, TaskContext ctx) {
        long versionId = (Long) input;
        if (ctx.isRetry()) {
            log.debugf("Aggregating version %d, retry %d", versionId, ctx.attempt());
        }
        return TaskOutcome.complete(validationService.aggregateAssetsSummary(versionId));
    }
}
