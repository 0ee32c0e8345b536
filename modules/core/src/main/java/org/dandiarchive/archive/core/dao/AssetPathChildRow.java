package org.dandiarchive.archive.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.util.UUID;

/**
 * Path node joined with the external id of its leaf asset, if any.
 */
public record AssetPathChildRow(
        @ColumnName("path") String path,
        @ColumnName("aggregate_files") long aggregateFiles,
        @ColumnName("aggregate_size") long aggregateSize,
        @ColumnName("asset_uuid") UUID assetUuid
) {}
