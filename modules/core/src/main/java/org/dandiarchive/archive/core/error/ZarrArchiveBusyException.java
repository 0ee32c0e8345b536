package org.dandiarchive.archive.core.error;

import org.dandiarchive.archive.types.ZarrArchiveStatus;

import java.util.UUID;

/**
 * Thrown when files are changed while a zarr archive is being ingested.
 */
public class ZarrArchiveBusyException extends ArchiveException {

    public ZarrArchiveBusyException(UUID zarrId, ZarrArchiveStatus status) {
        super(ErrorKind.CONFLICT, "Zarr archive " + zarrId + " is " + status + " and cannot be modified");
    }
}
