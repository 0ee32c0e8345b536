package org.dandiarchive.archive.core.error;

/**
 * A referenced blob, zarr archive, version or asset does not exist.
 */
public class ContentNotFoundException extends ArchiveException {

    public ContentNotFoundException(String what, Object id) {
        super(ErrorKind.NOT_FOUND, what + " not found: " + id);
    }
}
