package org.dandiarchive.archive.core.error;

import java.util.UUID;

public class ZarrUploadsOutstandingException extends ArchiveException {

    private final long outstanding;

    public ZarrUploadsOutstandingException(UUID zarrId, long outstanding) {
        super(ErrorKind.CONFLICT, "Zarr archive " + zarrId + " has " + outstanding + " outstanding uploads");
        this.outstanding = outstanding;
    }

    public long outstanding() {
        return outstanding;
    }
}
