package org.dandiarchive.archive.core.error;

/**
 * Zero or more than one backing content reference was supplied for an asset.
 */
public class ContentRefConflictException extends ArchiveException {

    public ContentRefConflictException(String message) {
        super(ErrorKind.INVALID_REQUEST, message);
    }
}
