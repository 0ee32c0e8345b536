package org.dandiarchive.archive.core.error;

/**
 * Version metadata changed between the read and the compare-and-swap write of
 * an aggregation pass. Retried by the task queue.
 */
public class VersionMetadataConcurrentlyModifiedException extends ArchiveException {

    private final long versionId;
    private final long expectedSeq;

    public VersionMetadataConcurrentlyModifiedException(long versionId, long expectedSeq) {
        super(ErrorKind.CONCURRENT_MODIFICATION,
                "Version " + versionId + " was modified concurrently (expected modified_seq=" + expectedSeq + ")");
        this.versionId = versionId;
        this.expectedSeq = expectedSeq;
    }

    public long versionId() {
        return versionId;
    }

    public long expectedSeq() {
        return expectedSeq;
    }
}
