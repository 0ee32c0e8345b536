package org.dandiarchive.archive.types;

public enum UploadValidationState {
    IN_PROGRESS,
    SUCCEEDED,
    FAILED
}
