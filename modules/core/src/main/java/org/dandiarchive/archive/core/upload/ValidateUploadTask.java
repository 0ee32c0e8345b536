package org.dandiarchive.archive.core.upload;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.storage.StorageException;
import org.dandiarchive.archive.core.task.ArchiveTask;
import org.dandiarchive.archive.core.task.TaskContext;
import org.dandiarchive.archive.core.task.TaskIO;
import org.dandiarchive.archive.core.task.TaskOutcome;

/**
 * Input: claimed SHA-256 hex digest. Output: the final validation state name.
 */
@ApplicationScoped
@TaskIO(input = String.class, output = String.class, softTimeLimitSeconds = 3600,
        retryOn = StorageException.class)
public class ValidateUploadTask implements ArchiveTask {

    public static final String TYPE = "validate.upload";

    private final UploadValidationService uploadValidationService;

    @Inject
    public ValidateUploadTask(UploadValidationService uploadValidationService) {
        this.uploadValidationService = uploadValidationService;
    }

    @Override
    public String taskType() {
        return TYPE;
    }

    @Override
    public TaskOutcome onStart(Object input, TaskContext ctx) {
        return TaskOutcome.settled(uploadValidationService.runValidation((String) input));
    }
}
