package org.dandiarchive.archive.core.version;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.UUID;

/**
 * Create or update request for an asset in a draft version. Exactly one of
 * {@code blobId} and {@code zarrId} must be set; {@code metadata} must carry the
 * asset's {@code path}.
 */
public record AssetRequest(UUID blobId, UUID zarrId, ObjectNode metadata) {

    public static AssetRequest blob(UUID blobId, ObjectNode metadata) {
        return new AssetRequest(blobId, null, metadata);
    }

    public static AssetRequest zarr(UUID zarrId, ObjectNode metadata) {
        return new AssetRequest(null, zarrId, metadata);
    }
}
