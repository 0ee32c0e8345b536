package org.dandiarchive.archive.core.asset;

import org.dandiarchive.archive.core.dao.AssetRecord;
import org.dandiarchive.archive.core.error.ContentRefConflictException;

/**
 * The single piece of content backing an asset: a blob, an embargoed blob or a
 * zarr archive. Ids are database ids of {@code asset_blob} / {@code zarr_archive} rows.
 */
public sealed interface AssetContent {

    record BlobContent(long blobId) implements AssetContent {}

    record EmbargoedBlobContent(long blobId) implements AssetContent {}

    record ZarrContent(long zarrId) implements AssetContent {}

    /**
     * Builds the content from nullable column-style references.
     *
     * @throws ContentRefConflictException unless exactly one reference is set
     */
    static AssetContent of(Long blobId, Long embargoedBlobId, Long zarrId) {
        int set = (blobId != null ? 1 : 0) + (embargoedBlobId != null ? 1 : 0) + (zarrId != null ? 1 : 0);
        if (set != 1) {
            throw new ContentRefConflictException(
                    "Exactly one of blob, embargoed blob or zarr must be referenced, got " + set);
        }
        if (blobId != null) {
            return new BlobContent(blobId);
        }
        if (embargoedBlobId != null) {
            return new EmbargoedBlobContent(embargoedBlobId);
        }
        return new ZarrContent(zarrId);
    }

    static AssetContent of(AssetRecord asset) {
        return of(asset.blobId(), asset.embargoedBlobId(), asset.zarrId());
    }

    default Long blobColumn() {
        return this instanceof BlobContent b ? b.blobId() : null;
    }

    default Long embargoedBlobColumn() {
        return this instanceof EmbargoedBlobContent e ? e.blobId() : null;
    }

    default Long zarrColumn() {
        return this instanceof ZarrContent z ? z.zarrId() : null;
    }

    default boolean isZarr() {
        return this instanceof ZarrContent;
    }
}
