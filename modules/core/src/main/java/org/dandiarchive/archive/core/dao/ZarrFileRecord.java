package org.dandiarchive.archive.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record ZarrFileRecord(
        @ColumnName("id") long id,
        @ColumnName("zarr_archive_id") long zarrArchiveId,
        @ColumnName("path") String path,
        @ColumnName("etag") String etag,
        @ColumnName("size") long size
) {}
