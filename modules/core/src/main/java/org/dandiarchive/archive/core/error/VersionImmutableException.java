package org.dandiarchive.archive.core.error;

/**
 * Thrown when an asset mutation targets a published (non-draft) version.
 */
public class VersionImmutableException extends ArchiveException {

    private final long versionId;

    public VersionImmutableException(long versionId, String version) {
        super(ErrorKind.CONFLICT, "Version " + version + " (id=" + versionId + ") is not a draft and cannot be modified");
        this.versionId = versionId;
    }

    public long versionId() {
        return versionId;
    }
}
