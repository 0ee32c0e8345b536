package org.dandiarchive.archive.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;
import java.util.UUID;

/**
 * A single-object upload. {@code sha256} is null until the checksum task fills it
 * and never changes afterwards.
 */
public record AssetBlobRecord(
        @ColumnName("id") long id,
        @ColumnName("blob_id") UUID blobId,
        @ColumnName("blob_key") String blobKey,
        @ColumnName("etag") String etag,
        @ColumnName("size") long size,
        @ColumnName("sha256") String sha256,
        @ColumnName("embargoed_dandiset_id") Long embargoedDandisetId,
        @ColumnName("created") Instant created,
        @ColumnName("modified") Instant modified
) {
    public boolean embargoed() {
        return embargoedDandisetId != null;
    }

    public boolean digestReady() {
        return sha256 != null;
    }
}
