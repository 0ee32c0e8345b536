package org.dandiarchive.archive.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

/**
 * One node of a version's path tree. Directory paths end with {@code /};
 * leaf rows carry the live asset's row id.
 */
public record AssetPathRecord(
        @ColumnName("id") long id,
        @ColumnName("version_id") long versionId,
        @ColumnName("path") String path,
        @ColumnName("parent_path") String parentPath,
        @ColumnName("asset_id") Long assetId,
        @ColumnName("aggregate_files") long aggregateFiles,
        @ColumnName("aggregate_size") long aggregateSize
) {
    public boolean isLeaf() {
        return assetId != null;
    }
}
