package org.dandiarchive.archive.core.error;

import java.util.UUID;

public class AssetNotInVersionException extends ArchiveException {

    public AssetNotInVersionException(UUID assetId, long versionId) {
        super(ErrorKind.NOT_FOUND, "Asset " + assetId + " is not part of version " + versionId);
    }
}
