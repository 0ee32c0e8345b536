package org.dandiarchive.archive.core.dao;

import org.dandiarchive.archive.types.ZarrArchiveStatus;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;
import java.util.UUID;

public record ZarrArchiveRecord(
        @ColumnName("id") long id,
        @ColumnName("zarr_id") UUID zarrId,
        @ColumnName("name") String name,
        @ColumnName("dandiset_id") long dandisetId,
        @ColumnName("file_count") long fileCount,
        @ColumnName("size") long size,
        @ColumnName("checksum") String checksum,
        @ColumnName("status") ZarrArchiveStatus status,
        @ColumnName("created") Instant created,
        @ColumnName("modified") Instant modified
) {
    public boolean checksumReady() {
        return status == ZarrArchiveStatus.COMPLETE && checksum != null;
    }
}
