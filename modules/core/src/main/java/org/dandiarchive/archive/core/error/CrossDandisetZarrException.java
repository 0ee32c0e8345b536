package org.dandiarchive.archive.core.error;

import java.util.UUID;

public class CrossDandisetZarrException extends ArchiveException {

    public CrossDandisetZarrException(UUID zarrId, long zarrDandisetId, long versionDandisetId) {
        super(ErrorKind.INVALID_REQUEST, "Zarr archive " + zarrId + " belongs to dandiset "
                + zarrDandisetId + ", not " + versionDandisetId);
    }
}
