package org.dandiarchive.archive.core.validation;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.task.ArchiveTask;
import org.dandiarchive.archive.core.task.TaskContext;
import org.dandiarchive.archive.core.task.TaskIO;
import org.dandiarchive.archive.core.task.TaskOutcome;

/**
 * Input: asset row id. Output: the {@link ValidationOutcome} name.
 */
@ApplicationScoped
@TaskIO(input = Long.class, output = String.class, softTimeLimitSeconds = 30)
public class ValidateAssetTask implements ArchiveTask {

    public static final String TYPE = "validate.asset";

    private final MetadataValidationService validationService;

    @Inject
    public ValidateAssetTask(MetadataValidationService validationService) {
        this.validationService = validationService;
    }

    @Override
    public String taskType() {
        return TYPE;
    }

    @Override
    public TaskOutcome onStart(Object input, TaskContext ctx) {
        long assetId = (Long) input;
        return TaskOutcome.settled(validationService.validateAsset(assetId));
    }
}
