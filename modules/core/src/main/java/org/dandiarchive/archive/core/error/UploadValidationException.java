package org.dandiarchive.archive.core.error;

/**
 * Rejected upload-validate request. The message is the client-facing reason.
 */
public class UploadValidationException extends ArchiveException {

    public UploadValidationException(ErrorKind kind, String message) {
        super(kind, message);
    }
}
